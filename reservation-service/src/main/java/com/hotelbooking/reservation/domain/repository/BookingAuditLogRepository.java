package com.hotelbooking.reservation.domain.repository;

import com.hotelbooking.reservation.domain.model.BookingAuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BookingAuditLogRepository extends JpaRepository<BookingAuditLog, Long> {

    List<BookingAuditLog> findByBookingIdOrderByIdAsc(Long bookingId);
}
