package com.hotelbooking.reservation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

@Configuration
public class ReservationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Retries a whole transaction after deadlock, lock timeout, version conflict or serialization failure.
     */
    @Bean
    public RetryTemplate reservationRetryTemplate(
            @Value("${reservation.retry.max-attempts:3}") int maxAttempts,
            @Value("${reservation.retry.initial-backoff-ms:50}") long initialBackoffMs,
            @Value("${reservation.retry.max-backoff-ms:1000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(ConcurrencyFailureException.class)
                .traversingCauses()
                .build();
    }
}
