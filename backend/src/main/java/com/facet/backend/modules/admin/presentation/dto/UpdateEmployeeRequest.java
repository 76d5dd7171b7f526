package com.facet.backend.modules.admin.presentation.dto;

import com.facet.backend.modules.auth.domain.EmployeeRole;

import jakarta.validation.constraints.Size;

/**
 * Omitted fields stay unchanged.
 */
public record UpdateEmployeeRequest(
        @Size(min = 1, max = 100)
        String name,
        EmployeeRole role,
        @Size(max = 128)
        String pin
) {

    @Override
    public String toString() {
        return "UpdateEmployeeRequest[name=" + name + ", role=" + role + "]";
    }
}
