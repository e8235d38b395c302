package com.hotelbooking.reservation.api.dto;

import com.hotelbooking.reservation.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        Long userId,
        Long roomTypeId,
        LocalDate startDate,
        LocalDate endDate,
        Integer roomsBooked,
        BigDecimal totalPrice,
        Booking.BookingStatus status,
        String cancellationReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getUserId(),
                booking.getRoomTypeId(),
                booking.getStartDate(),
                booking.getEndDate(),
                booking.getRoomsBooked(),
                booking.getTotalPrice(),
                booking.getStatus(),
                booking.getCancellationReason(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
