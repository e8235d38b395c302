package com.hotelbooking.reservation.events;

import com.hotelbooking.reservation.domain.model.Booking;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Published after a booking reaches CONFIRMED, either at creation or from PROVISIONAL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingConfirmedEvent {
    private Long bookingId;
    private Long userId;
    private Long roomTypeId;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer roomsBooked;
    private BigDecimal totalPrice;
    private Instant timestamp;

    public static BookingConfirmedEvent from(Booking booking) {
        return BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .userId(booking.getUserId())
                .roomTypeId(booking.getRoomTypeId())
                .startDate(booking.getStartDate())
                .endDate(booking.getEndDate())
                .roomsBooked(booking.getRoomsBooked())
                .totalPrice(booking.getTotalPrice())
                .timestamp(Instant.now())
                .build();
    }
}
