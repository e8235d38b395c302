package com.hotelbooking.reservation.domain.transaction;

import org.springframework.transaction.TransactionStatus;

/**
 * Handle on the database transaction a reservation or lifecycle operation runs in.
 * Every method that reads for a decision or writes inventory, bookings or keys takes one explicitly.
 */
public final class ReservationTransaction {

    private final TransactionStatus status;

    private ReservationTransaction(TransactionStatus status) {
        this.status = status;
    }

    public static ReservationTransaction of(TransactionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Transaction status must not be null");
        }
        return new ReservationTransaction(status);
    }

    /**
     * Fails fast when called outside a live transaction (already committed or rolled back).
     */
    public void requireActive() {
        if (status.isCompleted()) {
            throw new IllegalStateException("Reservation transaction is no longer active");
        }
    }
}
