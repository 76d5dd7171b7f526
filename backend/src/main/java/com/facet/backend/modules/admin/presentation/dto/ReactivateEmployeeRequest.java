package com.facet.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReactivateEmployeeRequest(
        @NotBlank
        @Size(max = 128)
        String pin
) {

    @Override
    public String toString() {
        return "ReactivateEmployeeRequest[pin=***]";
    }
}
