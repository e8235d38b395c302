package com.hotelbooking.reservation.exception;

import com.hotelbooking.common.exception.BusinessException;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import lombok.Getter;

/**
 * Request rejected before any lock is taken (bad date range, non-positive room count, ...).
 */
@Getter
public class InvalidReservationRequestException extends BusinessException {

    private final ErrorCode code;

    public InvalidReservationRequestException(ErrorCode code, String message) {
        super(message, code.name());
        this.code = code;
    }
}
