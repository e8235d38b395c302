package com.hotelbooking.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Binding of a request fingerprint to the booking it produced. Immutable once written.
 *
 * <p>New instances are always persisted (INSERT), never merged, so binding an existing key fails on
 * the primary key instead of silently matching the stored row.
 */
@Entity
@Table(name = "idempotency_keys", indexes = {
        @Index(name = "idx_idempotency_keys_created_at", columnList = "created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdempotencyKey implements Persistable<String> {

    @Id
    @Column(name = "idempotency_key", length = 64, updatable = false)
    private String key;

    @Column(name = "booking_id", nullable = false, unique = true, updatable = false)
    private Long bookingId;

    @Column(name = "metadata", columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Transient
    @Builder.Default
    private boolean newBinding = true;

    @Override
    public String getId() {
        return key;
    }

    @Override
    public boolean isNew() {
        return newBinding;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        newBinding = false;
    }
}
