package com.hotelbooking.reservation.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.model.IdempotencyKey;
import com.hotelbooking.reservation.domain.repository.BookingRepository;
import com.hotelbooking.reservation.domain.repository.IdempotencyKeyRepository;
import com.hotelbooking.reservation.domain.transaction.ReservationTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives request fingerprints and keeps the key to booking bindings that suppress retried requests.
 *
 * <p>A key is written only in the transaction that creates its booking. The primary key on
 * {@code idempotency_keys} makes a second insert of the same key abort that transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyKeyManager {

    private static final Pattern KEY_FORMAT = Pattern.compile("^[a-fA-F0-9]{64}$");
    private static final String FIELD_SEPARATOR = "|";

    private final IdempotencyKeyRepository idempotencyKeyRepository;
    private final BookingRepository bookingRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${reservation.idempotency.retention-days:7}")
    private int retentionDays;

    /**
     * SHA-256 over {@code userId|roomTypeId|start|end|roomsBooked}, dates in ISO format, as lowercase hex.
     */
    public String deriveKey(ReservationParams params) {
        String canonical = String.join(FIELD_SEPARATOR,
                String.valueOf(params.userId()),
                String.valueOf(params.roomTypeId()),
                params.startDate().toString(),
                params.endDate().toString(),
                String.valueOf(params.roomsBooked()));
        return HexFormat.of().formatHex(sha256(canonical));
    }

    /**
     * Uses a well-formed client key verbatim, otherwise falls back to {@link #deriveKey}.
     */
    public String acceptClientSuppliedKey(String candidate, ReservationParams params) {
        if (isWellFormed(candidate)) {
            return candidate;
        }
        if (candidate != null && !candidate.isBlank()) {
            log.debug("Ignoring malformed client idempotency key, deriving one instead");
        }
        return deriveKey(params);
    }

    public boolean isWellFormed(String candidate) {
        return candidate != null && KEY_FORMAT.matcher(candidate).matches();
    }

    /**
     * Booking bound to the key, if any. Plain read, takes no lock.
     */
    public Optional<Booking> lookup(String key) {
        return idempotencyKeyRepository.findById(key)
                .flatMap(binding -> bookingRepository.findById(binding.getBookingId()));
    }

    /**
     * Whether {@code booking} was created from the same parameters. A key bound to a booking with
     * different parameters is a conflict, not a replay.
     */
    public boolean matches(Booking booking, ReservationParams params) {
        return Objects.equals(booking.getUserId(), params.userId())
                && Objects.equals(booking.getRoomTypeId(), params.roomTypeId())
                && Objects.equals(booking.getStartDate(), params.startDate())
                && Objects.equals(booking.getEndDate(), params.endDate())
                && Objects.equals(booking.getRoomsBooked(), params.roomsBooked());
    }

    /**
     * Inserts the binding and flushes so a duplicate key fails here, inside the booking's transaction.
     */
    public IdempotencyKey bind(ReservationTransaction tx, String key, Long bookingId, IdempotencyMetadata metadata) {
        tx.requireActive();
        IdempotencyKey binding = IdempotencyKey.builder()
                .key(key)
                .bookingId(bookingId)
                .metadata(toJson(metadata))
                .createdAt(LocalDateTime.now(clock))
                .build();
        IdempotencyKey saved = idempotencyKeyRepository.saveAndFlush(binding);
        log.debug("Bound idempotency key {} to booking {}", key, bookingId);
        return saved;
    }

    public IdempotencyMetadata metadataFor(ReservationParams params, boolean clientSupplied) {
        return new IdempotencyMetadata(
                params.userId(),
                params.roomTypeId(),
                params.startDate().toString(),
                params.endDate().toString(),
                params.roomsBooked(),
                LocalDateTime.now(clock).toString(),
                clientSupplied);
    }

    /**
     * Deletes bindings older than the retention window. Bookings and inventory are untouched.
     *
     * @return number of keys removed
     */
    @Transactional
    public int sweepExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(retentionDays);
        int deleted = idempotencyKeyRepository.deleteCreatedBefore(cutoff);
        if (deleted > 0) {
            log.info("Swept {} idempotency keys created before {}", deleted, cutoff);
        }
        return deleted;
    }

    private String toJson(IdempotencyMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize idempotency metadata", e);
        }
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
