package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.common.exception.BusinessException;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import com.hotelbooking.reservation.domain.transaction.ReservationTransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Read-side and administrative access to inventory. Nothing here takes part in reservation decisions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final InventoryLockManager inventoryLockManager;
    private final DateRangeResolver dateRangeResolver;
    private final ReservationTransactionRunner transactionRunner;

    /**
     * Available rooms for every night of the range, ascending; nights without inventory show 0.
     */
    public List<InventoryAvailability> snapshot(Long roomTypeId, LocalDate startDate, LocalDate endDate) {
        List<LocalDate> nights = dateRangeResolver.resolve(startDate, endDate);
        return inventoryLockManager.snapshot(roomTypeId, nights).entrySet().stream()
                .map(entry -> new InventoryAvailability(entry.getKey(), entry.getValue()))
                .toList();
    }

    /**
     * Creates inventory for the nights that have none yet.
     *
     * @return number of nights created
     */
    public int provision(Long roomTypeId, LocalDate startDate, LocalDate endDate, int totalRooms,
                         BigDecimal pricePerNight) {
        if (totalRooms < 0) {
            throw new BusinessException("totalRooms must not be negative", ErrorCode.INVALID_REQUEST.name());
        }
        if (pricePerNight == null || pricePerNight.signum() < 0) {
            throw new BusinessException("pricePerNight must not be negative", ErrorCode.INVALID_REQUEST.name());
        }
        List<LocalDate> nights = dateRangeResolver.resolve(startDate, endDate);
        try {
            return provisionMissing(roomTypeId, nights, totalRooms, pricePerNight);
        } catch (DataIntegrityViolationException e) {
            // A concurrent provision inserted some of the same nights first; the rerun sees them as existing.
            log.info("Concurrent provisioning of room type {} detected, retrying once", roomTypeId);
            return provisionMissing(roomTypeId, nights, totalRooms, pricePerNight);
        }
    }

    private int provisionMissing(Long roomTypeId, List<LocalDate> nights, int totalRooms, BigDecimal pricePerNight) {
        return transactionRunner.execute(tx ->
                inventoryLockManager.provision(tx, roomTypeId, nights, totalRooms, pricePerNight));
    }

    /**
     * True when no record of the room type is negative or above its capacity.
     */
    public boolean verifyIntegrity(Long roomTypeId) {
        long inconsistent = inventoryLockManager.countInconsistentRecords(roomTypeId);
        if (inconsistent > 0) {
            log.error("Room type {} has {} inconsistent inventory records", roomTypeId, inconsistent);
            return false;
        }
        return true;
    }
}
