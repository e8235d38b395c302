package com.hotelbooking.reservation.domain.result;

/**
 * Failure codes returned by reservation and lifecycle operations.
 */
public enum ErrorCode {
    /** Not enough rooms on at least one night. Expected; the caller should offer other dates or fewer rooms. */
    INSUFFICIENT_INVENTORY,
    /** Lock timeout, deadlock, write conflict or other database abort. Safe to retry the whole operation. */
    CONCURRENCY_ABORT,
    /** A key already bound to a booking created from different parameters. Logged at ERROR. */
    IDEMPOTENCY_CONFLICT,
    /** Lifecycle transition not allowed from the booking's current status. */
    INVALID_STATE,
    INVALID_DATE_RANGE,
    INVALID_REQUEST,
    BOOKING_NOT_FOUND
}
