package com.hotelbooking.reservation.api.dto;

import com.hotelbooking.reservation.domain.service.InventoryAvailability;

import java.time.LocalDate;

public record InventorySnapshotEntry(LocalDate date, int availableRooms) {

    public static InventorySnapshotEntry from(InventoryAvailability availability) {
        return new InventorySnapshotEntry(availability.date(), availability.availableRooms());
    }
}
