package com.hotelbooking.reservation.domain.service;

import com.hotelbooking.reservation.domain.result.ErrorCode;
import com.hotelbooking.reservation.exception.InvalidReservationRequestException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a stay into the nights that consume inventory: check-in inclusive, check-out exclusive.
 * Reservation and restoration both go through here so they always agree on the affected dates.
 */
@Component
public class DateRangeResolver {

    public List<LocalDate> resolve(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new InvalidReservationRequestException(ErrorCode.INVALID_DATE_RANGE,
                    "Start date and end date are required");
        }
        if (!start.isBefore(end)) {
            throw new InvalidReservationRequestException(ErrorCode.INVALID_DATE_RANGE,
                    String.format("Start date %s must be before end date %s", start, end));
        }
        List<LocalDate> dates = new ArrayList<>();
        LocalDate current = start;
        while (current.isBefore(end)) {
            dates.add(current);
            current = current.plusDays(1);
        }
        return dates;
    }
}
