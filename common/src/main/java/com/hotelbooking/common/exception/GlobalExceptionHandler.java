package com.hotelbooking.common.exception;

import com.hotelbooking.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns exceptions escaping a controller into a {@link BaseResponse}.
 * Expected business outcomes are returned by the controllers themselves; what reaches this advice is
 * either a rejected request or a bug.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<BaseResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Lookup failed: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, BaseResponse.failure(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<BaseResponse<Void>> handleBusiness(BusinessException ex) {
        log.warn("Request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST,
                BaseResponse.failure(ex.getErrorCode(), ex.getMessage(), ex.getDetails()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<BaseResponse<Void>> handleInvalidBody(MethodArgumentNotValidException ex) {
        Map<String, String> violations = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            violations.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        ex.getBindingResult().getGlobalErrors()
                .forEach(error -> violations.putIfAbsent(error.getObjectName(), error.getDefaultMessage()));
        log.warn("Invalid request body: {}", violations);
        return respond(HttpStatus.BAD_REQUEST,
                BaseResponse.failure(VALIDATION_ERROR, "Validation failed", violations));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<BaseResponse<Void>> handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, BaseResponse.failure(VALIDATION_ERROR, "Malformed request"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BaseResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unhandled error while serving request", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                BaseResponse.failure(INTERNAL_ERROR, "An unexpected error occurred"));
    }

    private static ResponseEntity<BaseResponse<Void>> respond(HttpStatus status, BaseResponse<Void> body) {
        return ResponseEntity.status(status).body(body);
    }
}
