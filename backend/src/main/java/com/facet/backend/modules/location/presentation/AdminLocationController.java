package com.facet.backend.modules.location.presentation;

import java.util.List;
import java.util.UUID;

import com.facet.backend.global.security.SecurityUtils;
import com.facet.backend.modules.location.application.StorageLocationService;
import com.facet.backend.modules.location.presentation.dto.CreateLocationRequest;
import com.facet.backend.modules.location.presentation.dto.LocationResponse;
import com.facet.backend.modules.location.presentation.dto.UpdateLocationRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/locations")
public class AdminLocationController {

    private final StorageLocationService storageLocationService;

    public AdminLocationController(StorageLocationService storageLocationService) {
        this.storageLocationService = storageLocationService;
    }

    @GetMapping
    public ResponseEntity<List<LocationResponse>> listLocations(
            @RequestParam(name = "includeInactive", defaultValue = "true") boolean includeInactive
    ) {
        return ResponseEntity.ok(storageLocationService.listLocations(SecurityUtils.getCurrentPrincipal(),
                includeInactive));
    }

    @PostMapping
    public ResponseEntity<LocationResponse> createLocation(@Valid @RequestBody CreateLocationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(storageLocationService.createLocation(SecurityUtils.getCurrentPrincipal(), request));
    }

    @PutMapping("/{locationId}")
    public ResponseEntity<LocationResponse> updateLocation(
            @PathVariable UUID locationId,
            @Valid @RequestBody UpdateLocationRequest request
    ) {
        return ResponseEntity.ok(storageLocationService.updateLocation(SecurityUtils.getCurrentPrincipal(),
                locationId, request));
    }
}
