package com.hotelbooking.reservation.domain.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * @param insufficientDates every requested night that cannot supply the rooms, ascending
 * @param availableByDate   rooms available per requested night; 0 where no record exists
 */
public record InventoryValidationResult(
        boolean ok,
        List<LocalDate> insufficientDates,
        Map<LocalDate, Integer> availableByDate
) {
    /**
     * Fewest rooms available across the insufficient nights, or across all nights when none is short.
     */
    public int minimumAvailable() {
        List<LocalDate> scope = ok ? List.copyOf(availableByDate.keySet()) : insufficientDates;
        return scope.stream()
                .mapToInt(date -> availableByDate.getOrDefault(date, 0))
                .min()
                .orElse(0);
    }
}
