package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.reservation.domain.model.InventoryRecord;
import com.hotelbooking.reservation.domain.repository.InventoryRecordRepository;
import com.hotelbooking.reservation.domain.strategy.InventoryLockStrategy;
import com.hotelbooking.reservation.domain.transaction.ReservationTransaction;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Sole writer of {@code available_rooms}.
 *
 * <p>Rows are always acquired in ascending date order, by reservation and restoration alike, and only
 * changed while held by the caller's transaction. Lock strategies are injected by bean name
 * ({@code pessimistic}, {@code optimistic}) and selected with {@code reservation.inventory.lock-strategy}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryLockManager {

    private static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, InventoryLockStrategy> lockStrategies;
    private final InventoryRecordRepository repository;

    @Value("${reservation.inventory.lock-strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Inventory lock strategy: {}", getLockStrategy().getStrategyType());
    }

    /**
     * Holds every existing row for the nights, ascending by date, for the rest of {@code tx}.
     * Blocks while a concurrent transaction holds any of them.
     */
    public List<InventoryRecord> lockForUpdate(ReservationTransaction tx, Long roomTypeId, Collection<LocalDate> dates) {
        tx.requireActive();
        List<LocalDate> ascending = new ArrayList<>(new TreeSet<>(dates));
        if (ascending.isEmpty()) {
            return List.of();
        }
        return getLockStrategy().lock(roomTypeId, ascending);
    }

    /**
     * Checks every requested night. A night with no record counts as insufficient.
     */
    public InventoryValidationResult validate(List<InventoryRecord> lockedRecords, int requestedRooms,
                                              List<LocalDate> allRequestedDates) {
        Map<LocalDate, InventoryRecord> byDate = indexByDate(lockedRecords);
        Map<LocalDate, Integer> availableByDate = new LinkedHashMap<>();
        List<LocalDate> insufficient = new ArrayList<>();
        for (LocalDate date : new TreeSet<>(allRequestedDates)) {
            InventoryRecord record = byDate.get(date);
            int available = record == null ? 0 : record.getAvailableRooms();
            availableByDate.put(date, available);
            if (record == null || !record.hasAtLeast(requestedRooms)) {
                insufficient.add(date);
            }
        }
        return new InventoryValidationResult(insufficient.isEmpty(), List.copyOf(insufficient), availableByDate);
    }

    /**
     * Takes {@code roomsBooked} from each held row. Only valid after a successful {@link #validate}.
     */
    public void decrement(ReservationTransaction tx, List<InventoryRecord> lockedRecords, int roomsBooked) {
        tx.requireActive();
        for (InventoryRecord record : lockedRecords) {
            record.decreaseAvailability(roomsBooked);
        }
        repository.saveAllAndFlush(lockedRecords);
        log.debug("Decremented {} inventory rows by {}", lockedRecords.size(), roomsBooked);
    }

    /**
     * Gives {@code roomsBooked} back to each night. Takes the row locks itself so a restore cannot
     * interleave with a reservation checking the same nights.
     */
    public List<InventoryRecord> increment(ReservationTransaction tx, Long roomTypeId, Collection<LocalDate> dates,
                                           int roomsBooked) {
        List<InventoryRecord> locked = lockForUpdate(tx, roomTypeId, dates);
        Map<LocalDate, InventoryRecord> byDate = indexByDate(locked);
        for (LocalDate date : new TreeSet<>(dates)) {
            if (!byDate.containsKey(date)) {
                log.warn("No inventory row for room type {} on {}; nothing to restore", roomTypeId, date);
            }
        }
        for (InventoryRecord record : locked) {
            record.increaseAvailability(roomsBooked);
            if (record.getAvailableRooms() > record.getTotalRooms()) {
                log.warn("Inventory for room type {} on {} now exceeds capacity: {} > {}",
                        roomTypeId, record.getInventoryDate(), record.getAvailableRooms(), record.getTotalRooms());
            }
        }
        repository.saveAllAndFlush(locked);
        log.debug("Restored {} rooms on {} inventory rows for room type {}", roomsBooked, locked.size(), roomTypeId);
        return locked;
    }

    /**
     * Available rooms per night, ascending, 0 where no record exists.
     * Non-locking and possibly stale; never feed it into a reservation decision.
     */
    public Map<LocalDate, Integer> snapshot(Long roomTypeId, Collection<LocalDate> dates) {
        TreeSet<LocalDate> ascending = new TreeSet<>(dates);
        if (ascending.isEmpty()) {
            return Map.of();
        }
        Map<LocalDate, InventoryRecord> byDate = indexByDate(
                repository.findByRoomTypeIdAndInventoryDateInOrderByInventoryDateAsc(roomTypeId, ascending));
        Map<LocalDate, Integer> snapshot = new LinkedHashMap<>();
        for (LocalDate date : ascending) {
            InventoryRecord record = byDate.get(date);
            snapshot.put(date, record == null ? 0 : record.getAvailableRooms());
        }
        return snapshot;
    }

    /**
     * Creates the missing rows for the nights with {@code availableRooms = totalRooms}.
     * Existing rows are held but left unchanged.
     *
     * @return number of rows created
     */
    public int provision(ReservationTransaction tx, Long roomTypeId, Collection<LocalDate> dates, int totalRooms,
                         BigDecimal pricePerNight) {
        Map<LocalDate, InventoryRecord> existing = indexByDate(lockForUpdate(tx, roomTypeId, dates));
        List<InventoryRecord> created = new ArrayList<>();
        for (LocalDate date : new TreeSet<>(dates)) {
            if (existing.containsKey(date)) {
                continue;
            }
            created.add(InventoryRecord.builder()
                    .roomTypeId(roomTypeId)
                    .inventoryDate(date)
                    .availableRooms(totalRooms)
                    .totalRooms(totalRooms)
                    .pricePerNight(pricePerNight)
                    .build());
        }
        repository.saveAllAndFlush(created);
        log.info("Provisioned {} inventory rows for room type {} ({} already present)",
                created.size(), roomTypeId, existing.size());
        return created.size();
    }

    public long countInconsistentRecords(Long roomTypeId) {
        return repository.countInconsistentRecords(roomTypeId);
    }

    private InventoryLockStrategy getLockStrategy() {
        String strategyKey = strategyType == null ? DEFAULT_STRATEGY : strategyType.toLowerCase();
        InventoryLockStrategy strategy = lockStrategies.get(strategyKey);
        if (strategy == null) {
            log.warn("Unknown lock strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, lockStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = lockStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        "pessimistic lock strategy not found. Available strategies: " + lockStrategies.keySet());
            }
        }
        return strategy;
    }

    private static Map<LocalDate, InventoryRecord> indexByDate(List<InventoryRecord> records) {
        return records.stream().collect(Collectors.toMap(
                InventoryRecord::getInventoryDate, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }
}
