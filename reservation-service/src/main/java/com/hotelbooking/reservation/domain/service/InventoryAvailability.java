package com.hotelbooking.reservation.domain.service;

import java.time.LocalDate;

public record InventoryAvailability(LocalDate date, int availableRooms) {
}
