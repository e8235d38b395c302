package com.hotelbooking.reservation.domain.strategy;

import com.hotelbooking.reservation.domain.model.InventoryRecord;
import com.hotelbooking.reservation.domain.repository.InventoryRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Exclusive row locks (SELECT ... ORDER BY inventory_date FOR UPDATE).
 *
 * <p>Blocks while another transaction holds any of the rows. Because every caller locks in ascending
 * date order, two transactions over overlapping ranges cannot deadlock on these rows.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticInventoryLockStrategy implements InventoryLockStrategy {

    private final InventoryRecordRepository repository;

    @Override
    public List<InventoryRecord> lock(Long roomTypeId, List<LocalDate> ascendingDates) {
        List<InventoryRecord> records = repository.findForUpdateOrderByDate(roomTypeId, ascendingDates);
        log.debug("Locked {} of {} inventory rows for room type {} (FOR UPDATE)",
                records.size(), ascendingDates.size(), roomTypeId);
        return records;
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
