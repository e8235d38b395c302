package com.hotelbooking.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Available-room count for one room type on one night.
 * The row is the unit of locking: every change to {@code availableRooms} happens while it is held.
 */
@Entity
@Table(name = "room_inventory",
        uniqueConstraints = @UniqueConstraint(name = "uk_room_inventory_type_date",
                columnNames = {"room_type_id", "inventory_date"}),
        indexes = @Index(name = "idx_room_inventory_date", columnList = "inventory_date"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_type_id", nullable = false)
    private Long roomTypeId;

    @Column(name = "inventory_date", nullable = false)
    private LocalDate inventoryDate;

    @Column(name = "available_rooms", nullable = false)
    private Integer availableRooms;

    @Column(name = "total_rooms", nullable = false)
    private Integer totalRooms;

    @Column(name = "price_per_night", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerNight;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean hasAtLeast(int rooms) {
        return availableRooms >= rooms;
    }

    /**
     * Takes rooms out of the pool. The caller must hold the row and have validated it first.
     */
    public void decreaseAvailability(int rooms) {
        if (availableRooms < rooms) {
            throw new IllegalStateException(String.format(
                    "Inventory underflow for room type %d on %s: %d available, %d requested",
                    roomTypeId, inventoryDate, availableRooms, rooms));
        }
        availableRooms -= rooms;
    }

    /**
     * Puts rooms back into the pool (cancellation or expiry).
     */
    public void increaseAvailability(int rooms) {
        availableRooms += rooms;
    }
}
