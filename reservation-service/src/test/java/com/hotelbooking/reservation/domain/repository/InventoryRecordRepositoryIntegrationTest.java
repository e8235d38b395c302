package com.hotelbooking.reservation.domain.repository;

import com.hotelbooking.reservation.domain.model.Booking;
import com.hotelbooking.reservation.domain.model.IdempotencyKey;
import com.hotelbooking.reservation.domain.model.InventoryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository queries and schema constraints against a real PostgreSQL, schema created by Flyway.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class InventoryRecordRepositoryIntegrationTest {

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

    private static final LocalDate D1 = LocalDate.of(2026, 1, 1);
    private static final LocalDate D2 = LocalDate.of(2026, 1, 2);
    private static final LocalDate D3 = LocalDate.of(2026, 1, 3);

    @Autowired
    private InventoryRecordRepository inventoryRepository;
    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private IdempotencyKeyRepository idempotencyKeyRepository;

    @Test
    @DisplayName("findForUpdateOrderByDate returns the requested rows in ascending date order")
    void findForUpdate_ascending() {
        inventoryRepository.saveAllAndFlush(List.of(record(1L, D3, 5), record(1L, D1, 5), record(1L, D2, 5),
                record(2L, D1, 5)));

        List<InventoryRecord> locked = inventoryRepository.findForUpdateOrderByDate(1L, List.of(D2, D3, D1));

        assertThat(locked).extracting(InventoryRecord::getInventoryDate).containsExactly(D1, D2, D3);
        assertThat(locked).allSatisfy(r -> assertThat(r.getRoomTypeId()).isEqualTo(1L));
    }

    @Test
    @DisplayName("the schema rejects a second row for the same room type and night")
    void uniquePerRoomTypeAndDate() {
        inventoryRepository.saveAndFlush(record(3L, D1, 5));

        assertThatThrownBy(() -> inventoryRepository.saveAndFlush(record(3L, D1, 4)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("the schema rejects negative availability")
    void availabilityNeverNegative() {
        assertThatThrownBy(() -> inventoryRepository.saveAndFlush(record(4L, D1, -1)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("every update bumps the version column")
    void versionIncrementsOnUpdate() {
        InventoryRecord saved = inventoryRepository.saveAndFlush(record(5L, D1, 5));
        Long initialVersion = saved.getVersion();

        saved.decreaseAvailability(2);
        InventoryRecord updated = inventoryRepository.saveAndFlush(saved);

        assertThat(updated.getVersion()).isEqualTo(initialVersion + 1);
    }

    @Test
    @DisplayName("countInconsistentRecords flags availability above capacity")
    void countInconsistentRecords() {
        InventoryRecord overCapacity = record(6L, D1, 5);
        overCapacity.setTotalRooms(4);
        inventoryRepository.saveAllAndFlush(List.of(overCapacity, record(6L, D2, 5)));

        assertThat(inventoryRepository.countInconsistentRecords(6L)).isEqualTo(1);
        assertThat(inventoryRepository.countInconsistentRecords(7L)).isZero();
    }

    @Test
    @DisplayName("deleteCreatedBefore removes only keys older than the cutoff and leaves bookings alone")
    void deleteCreatedBefore() {
        Booking oldBooking = bookingRepository.saveAndFlush(booking());
        Booking newBooking = bookingRepository.saveAndFlush(booking());
        LocalDateTime now = LocalDateTime.of(2026, 1, 10, 12, 0);
        idempotencyKeyRepository.saveAndFlush(IdempotencyKey.builder()
                .key("a".repeat(64)).bookingId(oldBooking.getId()).createdAt(now.minusDays(8)).build());
        idempotencyKeyRepository.saveAndFlush(IdempotencyKey.builder()
                .key("b".repeat(64)).bookingId(newBooking.getId()).createdAt(now.minusDays(1)).build());

        int deleted = idempotencyKeyRepository.deleteCreatedBefore(now.minusDays(7));

        assertThat(deleted).isEqualTo(1);
        assertThat(idempotencyKeyRepository.findById("a".repeat(64))).isEmpty();
        assertThat(idempotencyKeyRepository.findById("b".repeat(64))).isPresent();
        assertThat(bookingRepository.findById(oldBooking.getId())).isPresent();
    }

    @Test
    @DisplayName("a booking can be bound to at most one key")
    void oneKeyPerBooking() {
        Booking booking = bookingRepository.saveAndFlush(booking());
        idempotencyKeyRepository.saveAndFlush(IdempotencyKey.builder()
                .key("c".repeat(64)).bookingId(booking.getId()).createdAt(LocalDateTime.now()).build());

        assertThatThrownBy(() -> idempotencyKeyRepository.saveAndFlush(IdempotencyKey.builder()
                .key("d".repeat(64)).bookingId(booking.getId()).createdAt(LocalDateTime.now()).build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private static InventoryRecord record(Long roomTypeId, LocalDate date, int available) {
        return InventoryRecord.builder()
                .roomTypeId(roomTypeId)
                .inventoryDate(date)
                .availableRooms(available)
                .totalRooms(Math.max(available, 10))
                .pricePerNight(BigDecimal.valueOf(100))
                .build();
    }

    private static Booking booking() {
        return Booking.builder()
                .userId(1L)
                .roomTypeId(1L)
                .startDate(D1)
                .endDate(D2)
                .roomsBooked(1)
                .status(Booking.BookingStatus.PROVISIONAL)
                .totalPrice(BigDecimal.valueOf(100))
                .build();
    }
}
