package com.hotelbooking.reservation.domain.repository;

import com.hotelbooking.reservation.domain.model.InventoryRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for {@link InventoryRecord}.
 * Provides the locking reads used by the lock strategies and a plain read for snapshots.
 */
public interface InventoryRecordRepository extends JpaRepository<InventoryRecord, Long> {

    /**
     * SELECT ... ORDER BY inventory_date FOR UPDATE.
     * Rows are locked in ascending date order; concurrent callers block until the holder commits or rolls back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           SELECT r FROM InventoryRecord r
           WHERE r.roomTypeId = :roomTypeId
             AND r.inventoryDate IN :dates
           ORDER BY r.inventoryDate ASC
           """)
    List<InventoryRecord> findForUpdateOrderByDate(@Param("roomTypeId") Long roomTypeId,
                                                   @Param("dates") Collection<LocalDate> dates);

    /**
     * Ordered read whose version is verified at commit (optimistic strategy).
     */
    @Lock(LockModeType.OPTIMISTIC)
    @Query("""
           SELECT r FROM InventoryRecord r
           WHERE r.roomTypeId = :roomTypeId
             AND r.inventoryDate IN :dates
           ORDER BY r.inventoryDate ASC
           """)
    List<InventoryRecord> findVersionedOrderByDate(@Param("roomTypeId") Long roomTypeId,
                                                   @Param("dates") Collection<LocalDate> dates);

    /**
     * Non-locking read. Never used for reservation decisions.
     */
    List<InventoryRecord> findByRoomTypeIdAndInventoryDateInOrderByInventoryDateAsc(
            Long roomTypeId, Collection<LocalDate> dates);

    Optional<InventoryRecord> findByRoomTypeIdAndInventoryDate(Long roomTypeId, LocalDate date);

    @Query("""
           SELECT COUNT(r) FROM InventoryRecord r
           WHERE r.roomTypeId = :roomTypeId
             AND (r.availableRooms < 0 OR r.availableRooms > r.totalRooms)
           """)
    long countInconsistentRecords(@Param("roomTypeId") Long roomTypeId);
}
