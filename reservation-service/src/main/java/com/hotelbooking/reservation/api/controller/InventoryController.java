package com.hotelbooking.reservation.api.controller;

import com.hotelbooking.common.dto.BaseResponse;
import com.hotelbooking.common.util.Constants;
import com.hotelbooking.reservation.api.dto.IntegrityResponse;
import com.hotelbooking.reservation.api.dto.InventorySnapshotEntry;
import com.hotelbooking.reservation.api.dto.ProvisionInventoryRequest;
import com.hotelbooking.reservation.api.dto.ProvisionInventoryResponse;
import com.hotelbooking.reservation.domain.service.InventoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * Inventory reads and administration. Snapshots are informational; reservations never rely on them.
 */
@RestController
@RequestMapping(Constants.API_V1 + "/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping("/{roomTypeId}")
    public ResponseEntity<BaseResponse<List<InventorySnapshotEntry>>> snapshot(
            @PathVariable Long roomTypeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        List<InventorySnapshotEntry> response = inventoryService.snapshot(roomTypeId, startDate, endDate).stream()
                .map(InventorySnapshotEntry::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{roomTypeId}/provision")
    public ResponseEntity<BaseResponse<ProvisionInventoryResponse>> provision(
            @PathVariable Long roomTypeId,
            @Valid @RequestBody ProvisionInventoryRequest request) {
        int created = inventoryService.provision(roomTypeId, request.startDate(), request.endDate(),
                request.totalRooms(), request.pricePerNight());
        return ResponseEntity.ok(BaseResponse.success("Inventory provisioned",
                new ProvisionInventoryResponse(roomTypeId, created)));
    }

    @GetMapping("/{roomTypeId}/integrity")
    public ResponseEntity<BaseResponse<IntegrityResponse>> integrity(@PathVariable Long roomTypeId) {
        boolean consistent = inventoryService.verifyIntegrity(roomTypeId);
        return ResponseEntity.ok(BaseResponse.success(new IntegrityResponse(roomTypeId, consistent)));
    }
}
