package com.hotelbooking.reservation.exception;

import com.hotelbooking.common.exception.BusinessException;
import com.hotelbooking.reservation.domain.result.ErrorCode;
import com.hotelbooking.reservation.domain.result.ErrorDetails;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown inside the reservation transaction when at least one night cannot satisfy the request,
 * so that the transaction rolls back before anything is written.
 */
@Getter
public class InsufficientInventoryException extends BusinessException {

    private final ErrorDetails errorDetails;

    public InsufficientInventoryException(Long roomTypeId, int requestedRooms, int availableRooms,
                                          List<LocalDate> conflictDates) {
        this(new ErrorDetails(roomTypeId, requestedRooms, availableRooms, List.copyOf(conflictDates)));
    }

    private InsufficientInventoryException(ErrorDetails details) {
        super(buildMessage(details), ErrorCode.INSUFFICIENT_INVENTORY.name(), details);
        this.errorDetails = details;
    }

    private static String buildMessage(ErrorDetails details) {
        String dates = details.conflictDates().stream()
                .map(LocalDate::toString)
                .collect(Collectors.joining(", "));
        return String.format("Insufficient inventory: requested %d rooms but only %d available on %s",
                details.requestedRooms(), details.availableRooms(), dates);
    }
}
