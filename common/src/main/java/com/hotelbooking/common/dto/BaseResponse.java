package com.hotelbooking.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope returned by every endpoint of the reservation API.
 * A failed call has {@code success = false}, an {@code errorCode} and, when the caller can act on it,
 * a {@code details} payload (for example the nights that ran out of rooms).
 *
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private boolean success;
    private String message;
    private T data;
    private String errorCode;
    private Object details;
    @Builder.Default
    private Instant timestamp = Instant.now();

    public static <T> BaseResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return BaseResponse.<T>builder().success(true).message(message).data(data).build();
    }

    public static <T> BaseResponse<T> failure(String errorCode, String message) {
        return failure(errorCode, message, null);
    }

    public static <T> BaseResponse<T> failure(String errorCode, String message, Object details) {
        return BaseResponse.<T>builder().errorCode(errorCode).message(message).details(details).build();
    }
}
