package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.reservation.domain.model.Booking;

import java.time.LocalDate;

/**
 * Parameters of a reservation attempt.
 *
 * @param initialStatus PROVISIONAL (awaiting payment) or CONFIRMED; null means PROVISIONAL
 */
public record ReservationParams(
        Long userId,
        Long roomTypeId,
        LocalDate startDate,
        LocalDate endDate,
        Integer roomsBooked,
        Booking.BookingStatus initialStatus
) {
    public ReservationParams(Long userId, Long roomTypeId, LocalDate startDate, LocalDate endDate, Integer roomsBooked) {
        this(userId, roomTypeId, startDate, endDate, roomsBooked, Booking.BookingStatus.PROVISIONAL);
    }

    public Booking.BookingStatus effectiveInitialStatus() {
        return initialStatus == null ? Booking.BookingStatus.PROVISIONAL : initialStatus;
    }
}
