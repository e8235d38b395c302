package com.hotelbooking.reservation.api.dto;

import com.hotelbooking.reservation.domain.result.BookingResult;

public record ReservationResponse(
        BookingResponse booking,
        String idempotencyKey,
        boolean replayed
) {
    public static ReservationResponse from(BookingResult result) {
        return new ReservationResponse(BookingResponse.from(result.booking()), result.idempotencyKey(), result.replayed());
    }
}
