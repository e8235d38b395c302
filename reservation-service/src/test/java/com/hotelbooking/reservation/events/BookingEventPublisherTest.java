package com.hotelbooking.reservation.events;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingEventPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    @InjectMocks
    private BookingEventPublisher publisher;

    @Test
    void onBookingConfirmed_sendsKeyedByBookingId() {
        ReflectionTestUtils.setField(publisher, "eventsEnabled", true);
        BookingConfirmedEvent event = BookingConfirmedEvent.builder().bookingId(42L).build();
        when(kafkaTemplate.send("booking-confirmed", "42", event))
                .thenReturn(new CompletableFuture<SendResult<String, Object>>());

        publisher.onBookingConfirmed(event);

        verify(kafkaTemplate).send("booking-confirmed", "42", event);
    }

    @Test
    void onBookingCancelled_failedSendIsOnlyLogged() {
        ReflectionTestUtils.setField(publisher, "eventsEnabled", true);
        BookingCancelledEvent event = BookingCancelledEvent.builder().bookingId(7L).build();
        when(kafkaTemplate.send("booking-cancelled", "7", event))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        publisher.onBookingCancelled(event);

        verify(kafkaTemplate).send("booking-cancelled", "7", event);
    }

    @Test
    void disabled_sendsNothing() {
        ReflectionTestUtils.setField(publisher, "eventsEnabled", false);

        publisher.onBookingConfirmed(BookingConfirmedEvent.builder().bookingId(1L).build());

        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
    }
}
