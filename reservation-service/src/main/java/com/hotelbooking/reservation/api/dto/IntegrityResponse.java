package com.hotelbooking.reservation.api.dto;

public record IntegrityResponse(Long roomTypeId, boolean consistent) {
}
