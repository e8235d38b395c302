package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.reservation.domain.model.InventoryRecord;
import com.hotelbooking.reservation.domain.repository.InventoryRecordRepository;
import com.hotelbooking.reservation.domain.strategy.InventoryLockStrategy;
import com.hotelbooking.reservation.domain.transaction.ReservationTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryLockManagerTest {

    private static final Long ROOM_TYPE = 42L;
    private static final LocalDate D1 = LocalDate.of(2025, 11, 1);
    private static final LocalDate D2 = LocalDate.of(2025, 11, 2);
    private static final LocalDate D3 = LocalDate.of(2025, 11, 3);

    @Mock
    private InventoryLockStrategy pessimistic;
    @Mock
    private InventoryLockStrategy optimistic;
    @Mock
    private InventoryRecordRepository repository;

    private InventoryLockManager manager;
    private ReservationTransaction tx;

    @BeforeEach
    void setUp() {
        manager = new InventoryLockManager(Map.of("pessimistic", pessimistic, "optimistic", optimistic), repository);
        ReflectionTestUtils.setField(manager, "strategyType", "pessimistic");
        tx = ReservationTransaction.of(new SimpleTransactionStatus());
    }

    @Test
    @DisplayName("lockForUpdate passes distinct dates in ascending order to the strategy")
    void lockForUpdate_sortsAndDeduplicates() {
        when(pessimistic.lock(ROOM_TYPE, List.of(D1, D2, D3))).thenReturn(List.of(record(D1, 5)));

        List<InventoryRecord> locked = manager.lockForUpdate(tx, ROOM_TYPE, List.of(D3, D1, D2, D1));

        assertThat(locked).hasSize(1);
        verify(pessimistic).lock(ROOM_TYPE, List.of(D1, D2, D3));
        verifyNoInteractions(optimistic);
    }

    @Test
    @DisplayName("lockForUpdate uses the configured strategy, case-insensitively")
    void lockForUpdate_selectsConfiguredStrategy() {
        ReflectionTestUtils.setField(manager, "strategyType", "OPTIMISTIC");
        when(optimistic.lock(any(), anyList())).thenReturn(List.of());

        manager.lockForUpdate(tx, ROOM_TYPE, List.of(D1));

        verify(optimistic).lock(ROOM_TYPE, List.of(D1));
        verifyNoInteractions(pessimistic);
    }

    @Test
    @DisplayName("lockForUpdate falls back to pessimistic for an unknown strategy name")
    void lockForUpdate_unknownStrategyFallsBack() {
        ReflectionTestUtils.setField(manager, "strategyType", "distributed");
        when(pessimistic.lock(any(), anyList())).thenReturn(List.of());

        manager.lockForUpdate(tx, ROOM_TYPE, List.of(D1));

        verify(pessimistic).lock(ROOM_TYPE, List.of(D1));
    }

    @Test
    @DisplayName("lockForUpdate refuses a completed transaction")
    void lockForUpdate_requiresActiveTransaction() {
        SimpleTransactionStatus status = new SimpleTransactionStatus();
        status.setCompleted();

        assertThatThrownBy(() -> manager.lockForUpdate(ReservationTransaction.of(status), ROOM_TYPE, List.of(D1)))
                .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(pessimistic);
    }

    @Test
    @DisplayName("validate passes when every night has enough rooms")
    void validate_ok() {
        InventoryValidationResult result = manager.validate(
                List.of(record(D1, 5), record(D2, 3)), 3, List.of(D1, D2));

        assertThat(result.ok()).isTrue();
        assertThat(result.insufficientDates()).isEmpty();
        assertThat(result.availableByDate()).containsExactly(entry(D1, 5), entry(D2, 3));
    }

    @Test
    @DisplayName("validate reports every short night, treating a missing record as zero")
    void validate_reportsAllInsufficientDates() {
        InventoryValidationResult result = manager.validate(
                List.of(record(D1, 2), record(D3, 5)), 3, List.of(D1, D2, D3));

        assertThat(result.ok()).isFalse();
        assertThat(result.insufficientDates()).containsExactly(D1, D2);
        assertThat(result.availableByDate()).containsEntry(D2, 0);
        assertThat(result.minimumAvailable()).isZero();
    }

    @Test
    @DisplayName("decrement subtracts from every held row and flushes")
    void decrement_subtractsAndFlushes() {
        List<InventoryRecord> locked = List.of(record(D1, 5), record(D2, 4));

        manager.decrement(tx, locked, 3);

        assertThat(locked).extracting(InventoryRecord::getAvailableRooms).containsExactly(2, 1);
        verify(repository).saveAllAndFlush(locked);
    }

    @Test
    @DisplayName("decrement never lets a row go negative")
    void decrement_refusesUnderflow() {
        List<InventoryRecord> locked = List.of(record(D1, 2));

        assertThatThrownBy(() -> manager.decrement(tx, locked, 3))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("underflow");
        verify(repository, never()).saveAllAndFlush(any());
    }

    @Test
    @DisplayName("increment locks the nights ascending before adding rooms back")
    void increment_locksThenRestores() {
        List<InventoryRecord> locked = List.of(record(D1, 2), record(D2, 2));
        when(pessimistic.lock(ROOM_TYPE, List.of(D1, D2))).thenReturn(locked);

        manager.increment(tx, ROOM_TYPE, List.of(D2, D1), 3);

        assertThat(locked).extracting(InventoryRecord::getAvailableRooms).containsExactly(5, 5);
        var inOrder = inOrder(pessimistic, repository);
        inOrder.verify(pessimistic).lock(ROOM_TYPE, List.of(D1, D2));
        inOrder.verify(repository).saveAllAndFlush(locked);
    }

    @Test
    @DisplayName("increment skips nights that have no inventory row")
    void increment_skipsMissingRows() {
        List<InventoryRecord> locked = List.of(record(D1, 2));
        when(pessimistic.lock(ROOM_TYPE, List.of(D1, D2))).thenReturn(locked);

        List<InventoryRecord> restored = manager.increment(tx, ROOM_TYPE, List.of(D1, D2), 1);

        assertThat(restored).singleElement().extracting(InventoryRecord::getAvailableRooms).isEqualTo(3);
    }

    @Test
    @DisplayName("snapshot reads without locking and reports missing nights as 0")
    void snapshot_nonLocking() {
        when(repository.findByRoomTypeIdAndInventoryDateInOrderByInventoryDateAsc(eq(ROOM_TYPE), any()))
                .thenReturn(List.of(record(D1, 4), record(D3, 1)));

        Map<LocalDate, Integer> snapshot = manager.snapshot(ROOM_TYPE, List.of(D3, D2, D1));

        assertThat(snapshot).containsExactly(entry(D1, 4), entry(D2, 0), entry(D3, 1));
        verifyNoInteractions(pessimistic, optimistic);
    }

    @Test
    @DisplayName("provision creates only the nights that are missing")
    @SuppressWarnings("unchecked")
    void provision_createsMissingOnly() {
        when(pessimistic.lock(ROOM_TYPE, List.of(D1, D2, D3))).thenReturn(List.of(record(D2, 1)));
        List<List<InventoryRecord>> saved = new ArrayList<>();
        when(repository.saveAllAndFlush(anyList())).thenAnswer(inv -> {
            saved.add(new ArrayList<>((List<InventoryRecord>) inv.getArgument(0)));
            return inv.getArgument(0);
        });

        int created = manager.provision(tx, ROOM_TYPE, List.of(D1, D2, D3), 10, BigDecimal.valueOf(120));

        assertThat(created).isEqualTo(2);
        assertThat(saved).singleElement().satisfies(records -> {
            assertThat(records).extracting(InventoryRecord::getInventoryDate).containsExactly(D1, D3);
            assertThat(records).allSatisfy(r -> {
                assertThat(r.getAvailableRooms()).isEqualTo(10);
                assertThat(r.getTotalRooms()).isEqualTo(10);
            });
        });
    }

    private static InventoryRecord record(LocalDate date, int available) {
        return InventoryRecord.builder()
                .roomTypeId(ROOM_TYPE)
                .inventoryDate(date)
                .availableRooms(available)
                .totalRooms(10)
                .pricePerNight(BigDecimal.valueOf(100))
                .version(0L)
                .build();
    }
}
