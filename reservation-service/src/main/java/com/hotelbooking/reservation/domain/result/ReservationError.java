package com.hotelbooking.reservation.domain.result;

public record ReservationError(
        ErrorCode error,
        String message,
        ErrorDetails details
) {
    public static ReservationError of(ErrorCode error, String message) {
        return new ReservationError(error, message, null);
    }
}
