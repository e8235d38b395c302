package com.hotelbooking.reservation.orchestration;

import com.hotelbooking.reservation.domain.model.Booking;

/**
 * @param replayed true when the key was already bound and the earlier booking is returned unchanged
 */
public record ReservationOutcome(Booking booking, String idempotencyKey, boolean replayed) {

    public static ReservationOutcome created(Booking booking, String idempotencyKey) {
        return new ReservationOutcome(booking, idempotencyKey, false);
    }

    public static ReservationOutcome replayed(Booking booking, String idempotencyKey) {
        return new ReservationOutcome(booking, idempotencyKey, true);
    }
}
