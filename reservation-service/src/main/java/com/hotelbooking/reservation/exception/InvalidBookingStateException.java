package com.hotelbooking.reservation.exception;

import com.hotelbooking.common.exception.BusinessException;
import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import lombok.Getter;

@Getter
public class InvalidBookingStateException extends BusinessException {

    private final Long bookingId;
    private final Booking.BookingStatus currentStatus;
    private final Booking.BookingStatus requestedStatus;

    public InvalidBookingStateException(Long bookingId, Booking.BookingStatus currentStatus,
                                        Booking.BookingStatus requestedStatus) {
        super(String.format("Cannot move booking %d from %s to %s", bookingId, currentStatus, requestedStatus),
                ErrorCode.INVALID_STATE.name());
        this.bookingId = bookingId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
