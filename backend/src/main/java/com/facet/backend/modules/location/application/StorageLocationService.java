package com.facet.backend.modules.location.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.location.domain.StorageLocation;
import com.facet.backend.modules.location.infrastructure.persistence.StorageLocationRepository;
import com.facet.backend.modules.location.presentation.dto.CreateLocationRequest;
import com.facet.backend.modules.location.presentation.dto.LocationResponse;
import com.facet.backend.modules.location.presentation.dto.UpdateLocationRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the list of storage locations. Names are unique ignoring case.
 */
@Service
@Transactional
public class StorageLocationService {

    private static final Logger log = LoggerFactory.getLogger(StorageLocationService.class);
    private static final String RESOURCE_TYPE = "STORAGE_LOCATION";

    private final StorageLocationRepository locationRepository;
    private final RequestGate requestGate;
    private final AuditLogService auditLogService;

    public StorageLocationService(
            StorageLocationRepository locationRepository,
            RequestGate requestGate,
            AuditLogService auditLogService
    ) {
        this.locationRepository = locationRepository;
        this.requestGate = requestGate;
        this.auditLogService = auditLogService;
    }

    /**
     * Active locations are visible to anyone who can read tickets; retired ones only to location managers.
     */
    @Transactional(readOnly = true)
    public List<LocationResponse> listLocations(SessionPrincipal actor, boolean includeInactive) {
        if (includeInactive) {
            requestGate.authorize(actor, Permission.MANAGE_LOCATIONS).orThrow();
            return toResponses(locationRepository.findAllByOrderByNameAsc());
        }
        requestGate.authorize(actor, Permission.VIEW_TICKET).orThrow();
        return toResponses(locationRepository.findByActiveTrueOrderByNameAsc());
    }

    public LocationResponse createLocation(SessionPrincipal actor, @NonNull CreateLocationRequest request) {
        requestGate.authorize(actor, Permission.MANAGE_LOCATIONS).orThrow();
        String name = requireName(request.name());
        ensureNameFree(name, null);

        StorageLocation location = new StorageLocation(name);
        try {
            locationRepository.saveAndFlush(location);
        } catch (DataIntegrityViolationException ex) {
            throw duplicateName();
        }

        auditLogService.record(new AuditLogCommand("LOCATION_CREATED", RESOURCE_TYPE, location.getId().toString(),
                actor, Map.of("name", name)));
        log.info("Created storage location {}", location.getId());
        return LocationResponse.from(location);
    }

    public LocationResponse updateLocation(SessionPrincipal actor, @NonNull UUID locationId,
                                           @NonNull UpdateLocationRequest request) {
        requestGate.authorize(actor, Permission.MANAGE_LOCATIONS).orThrow();
        StorageLocation location = locationRepository.findById(locationId)
                .orElseThrow(() -> ProblemException.notFound("Location not found"));

        Map<String, Object> detail = new LinkedHashMap<>();
        if (request.name() != null) {
            String name = requireName(request.name());
            if (!name.equals(location.getName())) {
                ensureNameFree(name, locationId);
                detail.put("name", name);
                location.rename(name);
            }
        }
        if (request.active() != null && request.active() != location.isActive()) {
            detail.put("active", request.active());
            location.setActive(request.active());
        }

        if (!detail.isEmpty()) {
            try {
                locationRepository.flush();
            } catch (DataIntegrityViolationException ex) {
                throw duplicateName();
            }
            auditLogService.record(new AuditLogCommand("LOCATION_UPDATED", RESOURCE_TYPE, locationId.toString(),
                    actor, detail));
        }
        return LocationResponse.from(location);
    }

    /**
     * Resolves a location a ticket is about to point at. Retired and unknown locations are rejected
     * as bad input rather than as missing resources.
     */
    @Transactional(readOnly = true)
    public StorageLocation requireActiveLocation(@NonNull UUID locationId) {
        return locationRepository.findByIdAndActiveTrue(locationId)
                .orElseThrow(() -> ProblemException.validation("Storage location is unknown or retired"));
    }

    private void ensureNameFree(String name, UUID excludeLocationId) {
        locationRepository.findByNameIgnoreCase(name)
                .filter(existing -> !existing.getId().equals(excludeLocationId))
                .ifPresent(existing -> {
                    throw duplicateName();
                });
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw ProblemException.validation("Name must not be blank");
        }
        return name.strip();
    }

    private static ProblemException duplicateName() {
        return ProblemException.conflict("A location with this name already exists");
    }

    private static List<LocationResponse> toResponses(List<StorageLocation> locations) {
        return locations.stream()
                .map(LocationResponse::from)
                .toList();
    }
}
