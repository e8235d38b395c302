package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.model.Booking.BookingStatus;
import com.hotelbooking.reservation.domain.model.BookingAuditLog;
import com.hotelbooking.reservation.domain.repository.BookingAuditLogRepository;
import com.hotelbooking.reservation.domain.repository.BookingRepository;
import com.hotelbooking.reservation.domain.transaction.ReservationTransaction;
import com.hotelbooking.reservation.events.BookingCancelledEvent;
import com.hotelbooking.reservation.events.BookingConfirmedEvent;
import com.hotelbooking.reservation.exception.BookingNotFoundException;
import com.hotelbooking.reservation.exception.InvalidBookingStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Post-creation lifecycle of a booking.
 *
 * <pre>
 * PROVISIONAL -> CONFIRMED | CANCELLED
 * CONFIRMED   -> CANCELLED | COMPLETED
 * </pre>
 *
 * Expiry and a failed payment are cancellations that only apply while the booking is PROVISIONAL.
 *
 * The booking row is locked before its status is read. Cancellation returns the rooms to inventory
 * in the same transaction; locks are taken booking row first, then inventory rows ascending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingStateMachine {

    static final String EXPIRED_REASON = "expired";
    static final String PAYMENT_FAILED_REASON = "payment failed";

    private final BookingRepository bookingRepository;
    private final BookingAuditLogRepository auditLogRepository;
    private final InventoryLockManager inventoryLockManager;
    private final DateRangeResolver dateRangeResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * PROVISIONAL to CONFIRMED, on a successful payment signal.
     */
    public Booking confirm(ReservationTransaction tx, Long bookingId) {
        Booking booking = lockBooking(tx, bookingId);
        BookingStatus from = requireTransition(booking, BookingStatus.CONFIRMED);
        booking.setStatus(BookingStatus.CONFIRMED);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        Booking saved = bookingRepository.save(booking);
        audit(saved, BookingAuditLog.Action.CONFIRMED, from, null);
        eventPublisher.publishEvent(BookingConfirmedEvent.from(saved));
        log.info("Booking {} confirmed", bookingId);
        return saved;
    }

    /**
     * Cancels and restores inventory. Cancelling a CANCELLED booking returns it untouched.
     */
    public Booking cancel(ReservationTransaction tx, Long bookingId, String reason) {
        Booking booking = lockBooking(tx, bookingId);
        if (booking.getStatus() == BookingStatus.CANCELLED) {
            log.info("Booking {} already cancelled, nothing to do", bookingId);
            return booking;
        }
        return doCancel(tx, booking, reason, BookingAuditLog.Action.CANCELLED);
    }

    /**
     * CONFIRMED to COMPLETED after the stay. No inventory effect.
     */
    public Booking complete(ReservationTransaction tx, Long bookingId) {
        Booking booking = lockBooking(tx, bookingId);
        BookingStatus from = requireTransition(booking, BookingStatus.COMPLETED);
        booking.setStatus(BookingStatus.COMPLETED);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        Booking saved = bookingRepository.save(booking);
        audit(saved, BookingAuditLog.Action.COMPLETED, from, null);
        log.info("Booking {} completed", bookingId);
        return saved;
    }

    /**
     * Cancels a booking still PROVISIONAL when its hold runs out. Any other status is left as is.
     */
    public Booking expire(ReservationTransaction tx, Long bookingId) {
        Booking booking = lockBooking(tx, bookingId);
        if (booking.getStatus() != BookingStatus.PROVISIONAL) {
            log.debug("Booking {} is {}, not expiring", bookingId, booking.getStatus());
            return booking;
        }
        return doCancel(tx, booking, EXPIRED_REASON, BookingAuditLog.Action.EXPIRED);
    }

    /**
     * Payment for the booking was declined. Only a PROVISIONAL booking is cancelled; a repeated signal
     * on the resulting CANCELLED booking is a no-op, and a paid booking cannot be failed.
     */
    public Booking failPayment(ReservationTransaction tx, Long bookingId) {
        Booking booking = lockBooking(tx, bookingId);
        if (booking.getStatus() == BookingStatus.CANCELLED) {
            log.info("Booking {} already cancelled, ignoring payment failure", bookingId);
            return booking;
        }
        if (booking.getStatus() != BookingStatus.PROVISIONAL) {
            log.warn("Payment failure reported for booking {} in status {}, rejected", bookingId, booking.getStatus());
            throw new InvalidBookingStateException(bookingId, booking.getStatus(), BookingStatus.CANCELLED);
        }
        return doCancel(tx, booking, PAYMENT_FAILED_REASON, BookingAuditLog.Action.CANCELLED);
    }

    private Booking doCancel(ReservationTransaction tx, Booking booking, String reason, BookingAuditLog.Action action) {
        BookingStatus from = requireTransition(booking, BookingStatus.CANCELLED);
        inventoryLockManager.increment(tx, booking.getRoomTypeId(),
                dateRangeResolver.resolve(booking.getStartDate(), booking.getEndDate()),
                booking.getRoomsBooked());
        booking.setStatus(BookingStatus.CANCELLED);
        booking.setCancellationReason(reason);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        Booking saved = bookingRepository.save(booking);
        audit(saved, action, from, reason);
        eventPublisher.publishEvent(BookingCancelledEvent.from(saved, from));
        log.info("Booking {} cancelled from {} ({}), {} rooms released",
                saved.getId(), from, reason, saved.getRoomsBooked());
        return saved;
    }

    private Booking lockBooking(ReservationTransaction tx, Long bookingId) {
        tx.requireActive();
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    private static BookingStatus requireTransition(Booking booking, BookingStatus target) {
        BookingStatus from = booking.getStatus();
        if (!from.canTransitionTo(target)) {
            throw new InvalidBookingStateException(booking.getId(), from, target);
        }
        return from;
    }

    private void audit(Booking booking, BookingAuditLog.Action action, BookingStatus from, String reason) {
        auditLogRepository.save(BookingAuditLog.builder()
                .bookingId(booking.getId())
                .action(action)
                .fromStatus(from)
                .toStatus(booking.getStatus())
                .reason(reason)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }
}
