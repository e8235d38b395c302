package com.hotelbooking.reservation.api.controller;

import com.hotelbooking.common.dto.BaseResponse;
import com.hotelbooking.common.util.Constants;
import com.hotelbooking.reservation.api.dto.AuditEntryResponse;
import com.hotelbooking.reservation.api.dto.BookingResponse;
import com.hotelbooking.reservation.api.dto.CancelBookingRequest;
import com.hotelbooking.reservation.api.dto.PaymentSignalRequest;
import com.hotelbooking.reservation.api.dto.ReservationResponse;
import com.hotelbooking.reservation.api.dto.ReserveBookingRequest;
import com.hotelbooking.reservation.domain.result.BookingResult;
import com.hotelbooking.reservation.domain.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for reservations and the booking lifecycle.
 */
@RestController
@RequestMapping(Constants.API_V1 + "/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<ReservationResponse>> reserve(
            @RequestHeader(value = Constants.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody ReserveBookingRequest request) {
        BookingResult result = bookingService.reserve(request.toParams(), idempotencyKey);
        if (!result.success()) {
            return BookingResultMapper.failure(result);
        }
        if (result.replayed()) {
            return ResponseEntity.ok(BaseResponse.success("Booking already exists", ReservationResponse.from(result)));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", ReservationResponse.from(result)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(BookingResponse.from(bookingService.getBooking(id))));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingsByUser(@PathVariable Long userId) {
        List<BookingResponse> response = bookingService.getBookingsByUser(userId).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{id}/audit")
    public ResponseEntity<BaseResponse<List<AuditEntryResponse>>> getAuditTrail(@PathVariable Long id) {
        List<AuditEntryResponse> response = bookingService.getAuditTrail(id).stream()
                .map(AuditEntryResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirm(@PathVariable Long id) {
        return toResponse(bookingService.confirm(id), "Booking confirmed");
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancel(
            @PathVariable Long id,
            @Valid @RequestBody(required = false) CancelBookingRequest request) {
        String reason = request == null ? null : request.reason();
        return toResponse(bookingService.cancel(id, reason), "Booking cancelled");
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<BaseResponse<BookingResponse>> complete(@PathVariable Long id) {
        return toResponse(bookingService.complete(id), "Booking completed");
    }

    @PostMapping("/{id}/payment-signal")
    public ResponseEntity<BaseResponse<BookingResponse>> paymentSignal(
            @PathVariable Long id,
            @Valid @RequestBody PaymentSignalRequest request) {
        return toResponse(bookingService.applyPaymentSignal(id, request.succeeded()), "Payment outcome applied");
    }

    private static ResponseEntity<BaseResponse<BookingResponse>> toResponse(BookingResult result, String message) {
        if (!result.success()) {
            return BookingResultMapper.failure(result);
        }
        return ResponseEntity.ok(BaseResponse.success(message, BookingResponse.from(result.booking())));
    }
}
