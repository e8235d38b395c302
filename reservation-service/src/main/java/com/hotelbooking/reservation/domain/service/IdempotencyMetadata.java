package com.hotelbooking.reservation.domain.service;

/**
 * Request context stored next to an idempotency key binding, for diagnosing conflicts.
 */
public record IdempotencyMetadata(
        Long userId,
        Long roomTypeId,
        String startDate,
        String endDate,
        Integer roomsBooked,
        String requestedAt,
        boolean clientSupplied
) {
}
