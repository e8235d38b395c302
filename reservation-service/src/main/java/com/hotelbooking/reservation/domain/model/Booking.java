package com.hotelbooking.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Booking of one or more rooms of a room type for a stay window.
 * Holds no inventory itself; its nights are derived from {@code startDate}/{@code endDate}.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_user_id", columnList = "user_id"),
        @Index(name = "idx_bookings_status_created_at", columnList = "status,created_at"),
        @Index(name = "idx_bookings_room_type_dates", columnList = "room_type_id,start_date,end_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "room_type_id", nullable = false)
    private Long roomTypeId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "rooms_booked", nullable = false)
    private Integer roomsBooked;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "total_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (status == null) {
            status = BookingStatus.PROVISIONAL;
        }
    }

    public enum BookingStatus {
        PROVISIONAL,
        CONFIRMED,
        CANCELLED,
        COMPLETED;

        public Set<BookingStatus> allowedTargets() {
            if (this == PROVISIONAL) {
                return EnumSet.of(CONFIRMED, CANCELLED);
            }
            if (this == CONFIRMED) {
                return EnumSet.of(CANCELLED, COMPLETED);
            }
            return EnumSet.noneOf(BookingStatus.class);
        }

        public boolean canTransitionTo(BookingStatus target) {
            return allowedTargets().contains(target);
        }

        /** Statuses a booking may be created in. */
        public boolean isInitial() {
            return this == PROVISIONAL || this == CONFIRMED;
        }
    }
}
