package com.hotelbooking.reservation.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Outcome reported by the payment provider for a provisional booking.
 */
public record PaymentSignalRequest(
        @NotNull(message = "Payment outcome cannot be null")
        Boolean succeeded
) {
}
