package com.hotelbooking.reservation.api.controller;

import com.hotelbooking.common.dto.BaseResponse;
import com.hotelbooking.reservation.domain.result.BookingResult;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import com.hotelbooking.reservation.domain.result.ReservationError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Renders failed {@link BookingResult}s in the {@link BaseResponse} envelope.
 */
final class BookingResultMapper {

    private BookingResultMapper() {
    }

    static HttpStatus statusOf(ErrorCode code) {
        if (code == ErrorCode.INSUFFICIENT_INVENTORY
                || code == ErrorCode.INVALID_STATE
                || code == ErrorCode.IDEMPOTENCY_CONFLICT) {
            return HttpStatus.CONFLICT;
        }
        if (code == ErrorCode.CONCURRENCY_ABORT) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (code == ErrorCode.BOOKING_NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.BAD_REQUEST;
    }

    static <T> ResponseEntity<BaseResponse<T>> failure(BookingResult result) {
        ReservationError error = result.error();
        BaseResponse<T> body = BaseResponse.failure(error.error().name(), error.message(), error.details());
        return ResponseEntity.status(statusOf(error.error())).body(body);
    }
}
