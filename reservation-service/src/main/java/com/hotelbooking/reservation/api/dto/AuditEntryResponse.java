package com.hotelbooking.reservation.api.dto;

import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.model.BookingAuditLog;

import java.time.LocalDateTime;

public record AuditEntryResponse(
        BookingAuditLog.Action action,
        Booking.BookingStatus fromStatus,
        Booking.BookingStatus toStatus,
        String reason,
        LocalDateTime createdAt
) {
    public static AuditEntryResponse from(BookingAuditLog entry) {
        return new AuditEntryResponse(entry.getAction(), entry.getFromStatus(), entry.getToStatus(),
                entry.getReason(), entry.getCreatedAt());
    }
}
