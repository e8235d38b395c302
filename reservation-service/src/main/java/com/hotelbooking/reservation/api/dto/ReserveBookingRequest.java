package com.hotelbooking.reservation.api.dto;

import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.service.ReservationParams;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;

public record ReserveBookingRequest(
        @NotNull(message = "User ID cannot be null")
        Long userId,

        @NotNull(message = "Room type ID cannot be null")
        Long roomTypeId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        @Positive(message = "Rooms booked must be positive")
        @NotNull(message = "Rooms booked cannot be null")
        Integer roomsBooked,

        Booking.BookingStatus initialStatus
) {
    public ReservationParams toParams() {
        return new ReservationParams(userId, roomTypeId, startDate, endDate, roomsBooked, initialStatus);
    }
}
