package com.hotelbooking.reservation.scheduling;

import com.hotelbooking.reservation.domain.service.IdempotencyKeyManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops idempotency keys past their retention window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyKeySweeper {

    private final IdempotencyKeyManager idempotencyKeyManager;

    @Value("${reservation.idempotency.sweep-enabled:true}")
    private boolean sweepEnabled;

    @Scheduled(fixedDelayString = "${reservation.idempotency.sweep-interval-ms:3600000}",
            initialDelayString = "${reservation.idempotency.sweep-interval-ms:3600000}")
    public void sweep() {
        if (!sweepEnabled) return;
        try {
            idempotencyKeyManager.sweepExpired();
        } catch (RuntimeException e) {
            log.error("Idempotency key sweep failed, will retry on next run", e);
        }
    }
}
