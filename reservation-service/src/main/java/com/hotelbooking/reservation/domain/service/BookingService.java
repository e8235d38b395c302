package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.common.exception.BusinessException;
import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.model.BookingAuditLog;
import com.hotelbooking.reservation.domain.repository.BookingAuditLogRepository;
import com.hotelbooking.reservation.domain.repository.BookingRepository;
import com.hotelbooking.reservation.domain.result.BookingResult;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import com.hotelbooking.reservation.domain.result.ErrorDetails;
import com.hotelbooking.reservation.domain.result.ReservationError;
import com.hotelbooking.reservation.domain.transaction.ReservationTransaction;
import com.hotelbooking.reservation.domain.transaction.ReservationTransactionRunner;
import com.hotelbooking.reservation.exception.BookingNotFoundException;
import com.hotelbooking.reservation.exception.IdempotencyConflictException;
import com.hotelbooking.reservation.exception.InsufficientInventoryException;
import com.hotelbooking.reservation.exception.InvalidBookingStateException;
import com.hotelbooking.reservation.exception.InvalidReservationRequestException;
import com.hotelbooking.reservation.orchestration.BookingOrchestrator;
import com.hotelbooking.reservation.orchestration.ReservationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Entry point for reservations and booking lifecycle changes.
 *
 * <p>Each call runs in its own transaction. Transient database aborts (deadlock, lock timeout,
 * version conflict, serialization failure) are retried with backoff; retrying a reservation is safe
 * because an attempt that did commit is found again through its idempotency key. Domain failures and
 * database errors are returned as {@link BookingResult} failures, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final ReservationTransactionRunner transactionRunner;
    private final BookingOrchestrator bookingOrchestrator;
    private final BookingStateMachine bookingStateMachine;
    private final IdempotencyKeyManager idempotencyKeyManager;
    private final BookingRepository bookingRepository;
    private final BookingAuditLogRepository auditLogRepository;
    private final RetryTemplate reservationRetryTemplate;

    public BookingResult reserve(ReservationParams params, String clientIdempotencyKey) {
        Optional<ReservationError> invalid = validate(params);
        if (invalid.isPresent()) {
            return BookingResult.failure(invalid.get());
        }
        try {
            ReservationOutcome outcome = withRetry(tx -> bookingOrchestrator.reserve(tx, params, clientIdempotencyKey));
            return outcome.replayed()
                    ? BookingResult.replayed(outcome.booking(), outcome.idempotencyKey())
                    : BookingResult.created(outcome.booking(), outcome.idempotencyKey());
        } catch (DataIntegrityViolationException e) {
            return resolveKeyCollision(params, clientIdempotencyKey, e);
        } catch (ConcurrencyFailureException e) {
            return concurrencyAbort("reserve room type " + params.roomTypeId(), e);
        } catch (DataAccessException e) {
            return databaseFailure("reserve room type " + params.roomTypeId(), e);
        } catch (BusinessException e) {
            return toFailure(e);
        }
    }

    public BookingResult confirm(Long bookingId) {
        return runLifecycle("confirm", bookingId, tx -> bookingStateMachine.confirm(tx, bookingId));
    }

    public BookingResult cancel(Long bookingId, String reason) {
        return runLifecycle("cancel", bookingId, tx -> bookingStateMachine.cancel(tx, bookingId, reason));
    }

    public BookingResult complete(Long bookingId) {
        return runLifecycle("complete", bookingId, tx -> bookingStateMachine.complete(tx, bookingId));
    }

    public BookingResult expire(Long bookingId) {
        return runLifecycle("expire", bookingId, tx -> bookingStateMachine.expire(tx, bookingId));
    }

    /**
     * Outcome reported by the payment collaborator. Success confirms a PROVISIONAL booking; failure
     * cancels it. A failure signal for a booking that is already paid is rejected with INVALID_STATE.
     */
    public BookingResult applyPaymentSignal(Long bookingId, boolean succeeded) {
        if (succeeded) {
            return confirm(bookingId);
        }
        return runLifecycle("fail payment of", bookingId, tx -> bookingStateMachine.failPayment(tx, bookingId));
    }

    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    @Transactional(readOnly = true)
    public List<Booking> getBookingsByUser(Long userId) {
        return bookingRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<BookingAuditLog> getAuditTrail(Long bookingId) {
        getBooking(bookingId);
        return auditLogRepository.findByBookingIdOrderByIdAsc(bookingId);
    }

    private BookingResult runLifecycle(String operation, Long bookingId, Function<ReservationTransaction, Booking> work) {
        if (bookingId == null) {
            return BookingResult.failure(ReservationError.of(ErrorCode.INVALID_REQUEST, "Booking id is required"));
        }
        try {
            return BookingResult.of(withRetry(work));
        } catch (ConcurrencyFailureException e) {
            return concurrencyAbort(operation + " booking " + bookingId, e);
        } catch (DataAccessException e) {
            return databaseFailure(operation + " booking " + bookingId, e);
        } catch (BusinessException e) {
            return toFailure(e);
        }
    }

    private <T> T withRetry(Function<ReservationTransaction, T> work) {
        return reservationRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying after transient database abort (attempt {}): {}",
                        context.getRetryCount() + 1, context.getLastThrowable().getMessage());
            }
            return transactionRunner.execute(work);
        });
    }

    /**
     * Two requests with the same key raced on disjoint inventory and the loser hit the key's primary key.
     * Its transaction is gone; read the winner's binding and decide between replay and conflict.
     */
    private BookingResult resolveKeyCollision(ReservationParams params, String clientKey,
                                              DataIntegrityViolationException cause) {
        String key = idempotencyKeyManager.acceptClientSuppliedKey(clientKey, params);
        Optional<Booking> existing = idempotencyKeyManager.lookup(key);
        if (existing.isEmpty()) {
            return databaseFailure("reserve room type " + params.roomTypeId(), cause);
        }
        Booking booking = existing.get();
        if (idempotencyKeyManager.matches(booking, params)) {
            log.info("Concurrent duplicate resolved as replay of booking {} for key {}", booking.getId(), key);
            return BookingResult.replayed(booking, key);
        }
        log.error("Idempotency key {} was bound concurrently to booking {} with different parameters",
                key, booking.getId());
        return toFailure(new IdempotencyConflictException(key, booking.getId()));
    }

    private Optional<ReservationError> validate(ReservationParams params) {
        if (params == null || params.userId() == null || params.roomTypeId() == null || params.roomsBooked() == null) {
            return Optional.of(ReservationError.of(ErrorCode.INVALID_REQUEST,
                    "userId, roomTypeId and roomsBooked are required"));
        }
        if (params.roomsBooked() < 1) {
            return Optional.of(new ReservationError(ErrorCode.INVALID_REQUEST,
                    "roomsBooked must be at least 1", ErrorDetails.forRoomType(params.roomTypeId())));
        }
        if (!params.effectiveInitialStatus().isInitial()) {
            return Optional.of(ReservationError.of(ErrorCode.INVALID_REQUEST,
                    "A booking can only be created PROVISIONAL or CONFIRMED"));
        }
        if (params.startDate() == null || params.endDate() == null || !params.startDate().isBefore(params.endDate())) {
            return Optional.of(ReservationError.of(ErrorCode.INVALID_DATE_RANGE,
                    String.format("Start date %s must be before end date %s", params.startDate(), params.endDate())));
        }
        return Optional.empty();
    }

    private BookingResult concurrencyAbort(String operation, ConcurrencyFailureException e) {
        log.warn("Gave up on {} after transient database aborts: {}", operation, e.getMessage());
        return BookingResult.failure(ReservationError.of(ErrorCode.CONCURRENCY_ABORT,
                "The request conflicted with concurrent updates, please retry"));
    }

    /**
     * A database error that is neither a lock conflict nor a key collision. The transaction was rolled
     * back, so nothing was written; the caller may retry like any other abort.
     */
    private BookingResult databaseFailure(String operation, DataAccessException e) {
        log.error("Database error during {}, transaction rolled back", operation, e);
        return BookingResult.failure(ReservationError.of(ErrorCode.CONCURRENCY_ABORT,
                "The request could not be completed, please retry"));
    }

    private BookingResult toFailure(BusinessException e) {
        if (e instanceof InsufficientInventoryException insufficient) {
            return BookingResult.failure(ErrorCode.INSUFFICIENT_INVENTORY, e.getMessage(), insufficient.getErrorDetails());
        }
        if (e instanceof IdempotencyConflictException) {
            return BookingResult.failure(ReservationError.of(ErrorCode.IDEMPOTENCY_CONFLICT, e.getMessage()));
        }
        if (e instanceof InvalidBookingStateException) {
            return BookingResult.failure(ReservationError.of(ErrorCode.INVALID_STATE, e.getMessage()));
        }
        if (e instanceof BookingNotFoundException) {
            return BookingResult.failure(ReservationError.of(ErrorCode.BOOKING_NOT_FOUND, e.getMessage()));
        }
        if (e instanceof InvalidReservationRequestException invalid) {
            return BookingResult.failure(ReservationError.of(invalid.getCode(), e.getMessage()));
        }
        throw e;
    }
}
