package com.hotelbooking.reservation.integration;

import com.hotelbooking.reservation.domain.result.BookingResult;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import com.hotelbooking.reservation.domain.service.BookingService;
import com.hotelbooking.reservation.domain.service.InventoryAvailability;
import com.hotelbooking.reservation.domain.service.InventoryService;
import com.hotelbooking.reservation.domain.service.ReservationParams;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Same guarantees with version-checked rows instead of FOR UPDATE: losers of a write conflict are
 * retried and never oversell.
 */
@SpringBootTest(properties = {
        "reservation.events.enabled=false",
        "reservation.idempotency.sweep-enabled=false",
        "reservation.booking.expiry-enabled=false",
        "reservation.inventory.lock-strategy=optimistic",
        "reservation.retry.max-attempts=10",
        "reservation.retry.initial-backoff-ms=10",
        "reservation.retry.max-backoff-ms=200"
})
@Testcontainers(disabledWithoutDocker = true)
class OptimisticLockingIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("reservation_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    private static final LocalDate START = LocalDate.of(2026, 3, 1);
    private static final LocalDate END = LocalDate.of(2026, 3, 4);

    @Autowired
    private BookingService bookingService;
    @Autowired
    private InventoryService inventoryService;

    @Test
    @DisplayName("concurrent writers on versioned rows never oversell")
    void concurrentReservations_neverOversell() throws Exception {
        long roomType = 5001L;
        inventoryService.provision(roomType, START, END, 10, BigDecimal.valueOf(90));
        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BookingResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                long userId = 10L + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return bookingService.reserve(new ReservationParams(userId, roomType, START, END, 2), null);
                }));
            }
            start.countDown();
            List<BookingResult> results = new ArrayList<>();
            for (Future<BookingResult> future : futures) {
                results.add(future.get(60, TimeUnit.SECONDS));
            }

            long succeeded = results.stream().filter(BookingResult::success).count();
            assertThat(succeeded).isBetween(1L, 5L);
            assertThat(results).filteredOn(r -> !r.success())
                    .allSatisfy(r -> assertThat(r.errorCode())
                            .isIn(ErrorCode.INSUFFICIENT_INVENTORY, ErrorCode.CONCURRENCY_ABORT));
            assertThat(inventoryService.snapshot(roomType, START, END))
                    .extracting(InventoryAvailability::availableRooms)
                    .containsOnly((int) (10 - 2 * succeeded));
            assertThat(inventoryService.verifyIntegrity(roomType)).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("cancel restores inventory under the optimistic strategy")
    void reserveCancel_roundTrip() {
        long roomType = 5002L;
        inventoryService.provision(roomType, START, END, 4, BigDecimal.valueOf(90));

        BookingResult reserved = bookingService.reserve(new ReservationParams(1L, roomType, START, END, 4), null);
        bookingService.cancel(reserved.booking().getId(), null);

        assertThat(inventoryService.snapshot(roomType, START, END))
                .extracting(InventoryAvailability::availableRooms)
                .containsOnly(4);
    }
}
