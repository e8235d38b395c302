package com.hotelbooking.reservation.exception;

import com.hotelbooking.common.exception.BusinessException;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import lombok.Getter;

/**
 * An idempotency key is already bound to a booking that was created from different parameters.
 */
@Getter
public class IdempotencyConflictException extends BusinessException {

    private final String idempotencyKey;
    private final Long existingBookingId;

    public IdempotencyConflictException(String idempotencyKey, Long existingBookingId) {
        super(String.format("Idempotency key %s is already bound to booking %d with different parameters",
                idempotencyKey, existingBookingId), ErrorCode.IDEMPOTENCY_CONFLICT.name());
        this.idempotencyKey = idempotencyKey;
        this.existingBookingId = existingBookingId;
    }
}
