package com.hotelbooking.reservation.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards booking lifecycle events to Kafka once the transaction that produced them has committed.
 * Rolled back transactions publish nothing.
 *
 * Topics:
 * - booking-confirmed: {@link BookingConfirmedEvent}
 * - booking-cancelled: {@link BookingCancelledEvent}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";
    static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${reservation.events.enabled:true}")
    private boolean eventsEnabled;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingConfirmed(BookingConfirmedEvent event) {
        publishEvent(TOPIC_BOOKING_CONFIRMED, String.valueOf(event.getBookingId()), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingCancelled(BookingCancelledEvent event) {
        publishEvent(TOPIC_BOOKING_CANCELLED, String.valueOf(event.getBookingId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        if (!eventsEnabled) {
            log.debug("Event publishing disabled, dropping {} for key {}", topic, key);
            return;
        }
        log.info("Publishing event to topic {}: {}", topic, event);

        CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: offset={}", topic, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {} for key {}", topic, key, ex);
            }
        });
    }
}
