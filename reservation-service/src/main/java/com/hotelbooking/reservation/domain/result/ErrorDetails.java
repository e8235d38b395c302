package com.hotelbooking.reservation.domain.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;
import java.util.List;

/**
 * Structured context of a failed reservation.
 *
 * @param availableRooms fewest rooms available across the conflicting nights (0 when a night has no inventory row)
 * @param conflictDates  every night that could not satisfy the request, ascending
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorDetails(
        Long roomTypeId,
        Integer requestedRooms,
        Integer availableRooms,
        List<LocalDate> conflictDates
) {
    public static ErrorDetails forRoomType(Long roomTypeId) {
        return new ErrorDetails(roomTypeId, null, null, null);
    }
}
