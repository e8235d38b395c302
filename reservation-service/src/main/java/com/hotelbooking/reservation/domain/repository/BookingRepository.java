package com.hotelbooking.reservation.domain.repository;

import com.hotelbooking.reservation.domain.model.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    List<Booking> findByUserIdOrderByCreatedAtDesc(Long userId);

    /** Serializes lifecycle transitions of a single booking. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    /** For the expiry job: bookings still in the given status created before the cutoff, oldest first. */
    @Query("SELECT b.id FROM Booking b WHERE b.status = :status AND b.createdAt < :before ORDER BY b.createdAt")
    List<Long> findIdsByStatusCreatedBefore(@Param("status") Booking.BookingStatus status,
                                            @Param("before") LocalDateTime before);
}
