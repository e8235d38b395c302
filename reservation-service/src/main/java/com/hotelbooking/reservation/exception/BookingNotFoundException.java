package com.hotelbooking.reservation.exception;

import com.hotelbooking.common.exception.ResourceNotFoundException;
import com.hotelbooking.reservation.domain.result.ErrorCode;

/**
 * No booking with the given id. Reported as {@link ErrorCode#BOOKING_NOT_FOUND} on every path,
 * whether it is returned in a {@code BookingResult} or rendered by the exception handler.
 */
public class BookingNotFoundException extends ResourceNotFoundException {

    public BookingNotFoundException(Long bookingId) {
        super("Booking", bookingId, ErrorCode.BOOKING_NOT_FOUND.name());
    }
}
