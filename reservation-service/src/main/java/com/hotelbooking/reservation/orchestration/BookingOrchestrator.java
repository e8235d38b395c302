package com.hotelbooking.reservation.orchestration;

import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.model.BookingAuditLog;
import com.hotelbooking.reservation.domain.model.InventoryRecord;
import com.hotelbooking.reservation.domain.repository.BookingAuditLogRepository;
import com.hotelbooking.reservation.domain.repository.BookingRepository;
import com.hotelbooking.reservation.domain.service.DateRangeResolver;
import com.hotelbooking.reservation.domain.service.IdempotencyKeyManager;
import com.hotelbooking.reservation.domain.service.InventoryLockManager;
import com.hotelbooking.reservation.domain.service.InventoryValidationResult;
import com.hotelbooking.reservation.domain.service.ReservationParams;
import com.hotelbooking.reservation.domain.transaction.ReservationTransaction;
import com.hotelbooking.reservation.events.BookingConfirmedEvent;
import com.hotelbooking.reservation.exception.IdempotencyConflictException;
import com.hotelbooking.reservation.exception.InsufficientInventoryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Creates a booking in one transaction.
 *
 * Flow:
 * 1. Derive or accept the idempotency key; a bound key with the same parameters is replayed
 * 2. Resolve the nights and lock their inventory rows, ascending by date
 * 3. Check the key again under the locks (an identical request may have committed while we waited)
 * 4. Validate every night, decrement, insert the booking, bind the key, write the audit row
 *
 * Any exception rolls back everything, so a decrement is never visible without its booking and key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingOrchestrator {

    private final DateRangeResolver dateRangeResolver;
    private final IdempotencyKeyManager idempotencyKeyManager;
    private final InventoryLockManager inventoryLockManager;
    private final BookingRepository bookingRepository;
    private final BookingAuditLogRepository auditLogRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReservationOutcome reserve(ReservationTransaction tx, ReservationParams params, String clientIdempotencyKey) {
        tx.requireActive();
        boolean clientSupplied = idempotencyKeyManager.isWellFormed(clientIdempotencyKey);
        String key = idempotencyKeyManager.acceptClientSuppliedKey(clientIdempotencyKey, params);

        Optional<ReservationOutcome> replay = findReplay(key, params);
        if (replay.isPresent()) {
            return replay.get();
        }

        List<LocalDate> nights = dateRangeResolver.resolve(params.startDate(), params.endDate());
        List<InventoryRecord> locked = inventoryLockManager.lockForUpdate(tx, params.roomTypeId(), nights);

        replay = findReplay(key, params);
        if (replay.isPresent()) {
            log.info("Idempotency key {} was bound while waiting for inventory locks", key);
            return replay.get();
        }

        int rooms = params.roomsBooked();
        InventoryValidationResult validation = inventoryLockManager.validate(locked, rooms, nights);
        if (!validation.ok()) {
            log.info("Insufficient inventory for room type {}: {} rooms requested, short on {}",
                    params.roomTypeId(), rooms, validation.insufficientDates());
            throw new InsufficientInventoryException(params.roomTypeId(), rooms,
                    validation.minimumAvailable(), validation.insufficientDates());
        }

        inventoryLockManager.decrement(tx, locked, rooms);

        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = bookingRepository.save(Booking.builder()
                .userId(params.userId())
                .roomTypeId(params.roomTypeId())
                .startDate(params.startDate())
                .endDate(params.endDate())
                .roomsBooked(rooms)
                .status(params.effectiveInitialStatus())
                .totalPrice(totalPrice(locked, rooms))
                .createdAt(now)
                .updatedAt(now)
                .build());

        idempotencyKeyManager.bind(tx, key, booking.getId(),
                idempotencyKeyManager.metadataFor(params, clientSupplied));

        auditLogRepository.save(BookingAuditLog.builder()
                .bookingId(booking.getId())
                .action(BookingAuditLog.Action.CREATED)
                .toStatus(booking.getStatus())
                .createdAt(now)
                .build());

        if (booking.getStatus() == Booking.BookingStatus.CONFIRMED) {
            eventPublisher.publishEvent(BookingConfirmedEvent.from(booking));
        }

        log.info("Created booking {} ({}) for user {}: room type {}, {} x {} nights from {}",
                booking.getId(), booking.getStatus(), params.userId(), params.roomTypeId(),
                rooms, nights.size(), params.startDate());
        return ReservationOutcome.created(booking, key);
    }

    private Optional<ReservationOutcome> findReplay(String key, ReservationParams params) {
        Optional<Booking> existing = idempotencyKeyManager.lookup(key);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Booking booking = existing.get();
        if (!idempotencyKeyManager.matches(booking, params)) {
            log.error("Idempotency key {} is bound to booking {} created from different parameters",
                    key, booking.getId());
            throw new IdempotencyConflictException(key, booking.getId());
        }
        log.info("Replaying booking {} for idempotency key {}", booking.getId(), key);
        return Optional.of(ReservationOutcome.replayed(booking, key));
    }

    private static BigDecimal totalPrice(List<InventoryRecord> nights, int rooms) {
        BigDecimal perRoom = nights.stream()
                .map(InventoryRecord::getPricePerNight)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return perRoom.multiply(BigDecimal.valueOf(rooms));
    }
}
