package com.hotelbooking.reservation.events;

import com.hotelbooking.reservation.domain.model.Booking;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Published after a booking is cancelled or expires and its rooms are back in inventory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCancelledEvent {
    private Long bookingId;
    private Long userId;
    private Long roomTypeId;
    private LocalDate startDate;
    private LocalDate endDate;
    private Integer roomsReleased;
    private String previousStatus;
    private String reason;
    private Instant timestamp;

    public static BookingCancelledEvent from(Booking booking, Booking.BookingStatus previousStatus) {
        return BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .userId(booking.getUserId())
                .roomTypeId(booking.getRoomTypeId())
                .startDate(booking.getStartDate())
                .endDate(booking.getEndDate())
                .roomsReleased(booking.getRoomsBooked())
                .previousStatus(previousStatus.name())
                .reason(booking.getCancellationReason())
                .timestamp(Instant.now())
                .build();
    }
}
