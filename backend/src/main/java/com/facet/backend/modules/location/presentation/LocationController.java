package com.facet.backend.modules.location.presentation;

import java.util.List;

import com.facet.backend.global.security.SecurityUtils;
import com.facet.backend.modules.location.application.StorageLocationService;
import com.facet.backend.modules.location.presentation.dto.LocationResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Active locations for the intake form.
 */
@RestController
@RequestMapping("/api/v1/locations")
public class LocationController {

    private final StorageLocationService storageLocationService;

    public LocationController(StorageLocationService storageLocationService) {
        this.storageLocationService = storageLocationService;
    }

    @GetMapping
    public ResponseEntity<List<LocationResponse>> listActiveLocations() {
        return ResponseEntity.ok(storageLocationService.listLocations(SecurityUtils.getCurrentPrincipal(), false));
    }
}
