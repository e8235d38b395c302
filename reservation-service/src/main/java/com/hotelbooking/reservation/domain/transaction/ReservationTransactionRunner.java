package com.hotelbooking.reservation.domain.transaction;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * Runs a unit of work in a new transaction and hands it the {@link ReservationTransaction}.
 * A runtime exception thrown by the work rolls the whole transaction back.
 */
@Component
public class ReservationTransactionRunner {

    private final TransactionTemplate transactionTemplate;

    public ReservationTransactionRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public <T> T execute(Function<ReservationTransaction, T> work) {
        return transactionTemplate.execute(status -> work.apply(ReservationTransaction.of(status)));
    }
}
