package com.facet.backend.modules.location.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateLocationRequest(
        @NotBlank
        @Size(max = 100)
        String name
) {
}
