package com.facet.backend.modules.location.presentation.dto;

import java.util.UUID;

import com.facet.backend.modules.location.domain.StorageLocation;

public record LocationResponse(
        UUID locationId,
        String name,
        boolean active
) {

    public static LocationResponse from(StorageLocation location) {
        return new LocationResponse(location.getId(), location.getName(), location.isActive());
    }
}
