package com.hotelbooking.reservation.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ProvisionInventoryRequest(
        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        @NotNull(message = "Total rooms cannot be null")
        @PositiveOrZero(message = "Total rooms must not be negative")
        Integer totalRooms,

        @NotNull(message = "Price per night cannot be null")
        @DecimalMin(value = "0.00", message = "Price per night must not be negative")
        BigDecimal pricePerNight
) {
}
