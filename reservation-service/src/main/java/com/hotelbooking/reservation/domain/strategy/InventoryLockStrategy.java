package com.hotelbooking.reservation.domain.strategy;

import com.hotelbooking.reservation.domain.model.InventoryRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * How inventory rows are held for the rest of the current transaction.
 *
 * <p>Implementations are registered under their bean name and picked by
 * {@code reservation.inventory.lock-strategy}:
 * <ul>
 *   <li>pessimistic: SELECT ... FOR UPDATE, for stores with row-level locks</li>
 *   <li>optimistic: versioned read, conflicting writers fail at flush and are retried</li>
 * </ul>
 */
public interface InventoryLockStrategy {

    /**
     * Acquires the rows for the given nights. Must run inside an active transaction.
     *
     * @param ascendingDates distinct dates, ascending; rows are acquired in this order
     * @return the existing records in ascending date order; nights without a row are absent
     */
    List<InventoryRecord> lock(Long roomTypeId, List<LocalDate> ascendingDates);

    String getStrategyType();
}
