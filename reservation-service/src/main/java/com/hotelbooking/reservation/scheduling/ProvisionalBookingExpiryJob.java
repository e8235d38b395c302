package com.hotelbooking.reservation.scheduling;

import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.repository.BookingRepository;
import com.hotelbooking.reservation.domain.result.BookingResult;
import com.hotelbooking.reservation.domain.service.BookingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Releases the rooms of bookings left PROVISIONAL longer than the hold TTL (payment never arrived).
 * Each booking expires in its own transaction; one failure does not stop the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProvisionalBookingExpiryJob {

    private final BookingRepository bookingRepository;
    private final BookingService bookingService;
    private final Clock clock;

    @Value("${reservation.booking.expiry-enabled:true}")
    private boolean expiryEnabled;

    @Value("${reservation.booking.provisional-ttl-minutes:30}")
    private int provisionalTtlMinutes;

    @Scheduled(fixedDelayString = "${reservation.booking.expiry-interval-ms:60000}")
    public void expireStaleBookings() {
        if (!expiryEnabled) return;
        LocalDateTime cutoff = LocalDateTime.now(clock).minusMinutes(provisionalTtlMinutes);
        List<Long> stale = bookingRepository.findIdsByStatusCreatedBefore(Booking.BookingStatus.PROVISIONAL, cutoff);
        if (stale.isEmpty()) return;
        log.info("Expiring {} provisional booking(s) created before {}", stale.size(), cutoff);
        int expired = 0;
        for (Long bookingId : stale) {
            BookingResult result = bookingService.expire(bookingId);
            if (result.success()) {
                expired++;
            } else {
                log.warn("Could not expire booking {}: {} ({})", bookingId, result.errorCode(),
                        result.error().message());
            }
        }
        log.info("Expired {} of {} provisional booking(s)", expired, stale.size());
    }
}
