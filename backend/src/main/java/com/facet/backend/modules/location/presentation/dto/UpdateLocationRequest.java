package com.facet.backend.modules.location.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Omitted fields stay unchanged.
 */
public record UpdateLocationRequest(
        @Size(min = 1, max = 100)
        String name,
        Boolean active
) {
}
