package com.hotelbooking.reservation.domain.strategy;

import com.hotelbooking.reservation.domain.model.InventoryRecord;
import com.hotelbooking.reservation.domain.repository.InventoryRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Version-checked reads for stores without explicit row locks.
 *
 * <p>Takes no lock on read. Every write bumps {@code version}; a concurrent writer that read the same
 * version fails at flush with an optimistic locking failure, which rolls its transaction back and is
 * retried by the caller.
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticInventoryLockStrategy implements InventoryLockStrategy {

    private final InventoryRecordRepository repository;

    @Override
    public List<InventoryRecord> lock(Long roomTypeId, List<LocalDate> ascendingDates) {
        List<InventoryRecord> records = repository.findVersionedOrderByDate(roomTypeId, ascendingDates);
        log.debug("Read {} of {} versioned inventory rows for room type {}",
                records.size(), ascendingDates.size(), roomTypeId);
        return records;
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}
