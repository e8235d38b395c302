package com.hotelbooking.reservation.domain.result;

import com.hotelbooking.reservation.domain.model.Booking;

/**
 * Outcome of a reservation or lifecycle operation. Exactly one of {@code booking} and {@code error} is set.
 *
 * @param replayed true when the request matched an earlier one and the original booking was returned
 */
public record BookingResult(
        boolean success,
        Booking booking,
        String idempotencyKey,
        boolean replayed,
        ReservationError error
) {
    public static BookingResult created(Booking booking, String idempotencyKey) {
        return new BookingResult(true, booking, idempotencyKey, false, null);
    }

    public static BookingResult replayed(Booking booking, String idempotencyKey) {
        return new BookingResult(true, booking, idempotencyKey, true, null);
    }

    public static BookingResult of(Booking booking) {
        return new BookingResult(true, booking, null, false, null);
    }

    public static BookingResult failure(ReservationError error) {
        return new BookingResult(false, null, null, false, error);
    }

    public static BookingResult failure(ErrorCode code, String message, ErrorDetails details) {
        return failure(new ReservationError(code, message, details));
    }

    public ErrorCode errorCode() {
        return error == null ? null : error.error();
    }
}
