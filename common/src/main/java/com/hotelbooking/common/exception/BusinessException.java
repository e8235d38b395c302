package com.hotelbooking.common.exception;

import lombok.Getter;

/**
 * Base class for failures the caller caused and can act on.
 * {@code errorCode} is stable and machine readable; {@code details} is rendered as-is into the response.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;
    private final transient Object details;

    public BusinessException(String message, String errorCode) {
        this(message, errorCode, null);
    }

    public BusinessException(String message, String errorCode, Object details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details;
    }
}
