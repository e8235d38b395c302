package com.hotelbooking.reservation.api.dto;

public record ProvisionInventoryResponse(Long roomTypeId, int recordsCreated) {
}
