package com.facet.backend.modules.admin.presentation.dto;

import com.facet.backend.modules.auth.domain.EmployeeRole;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateEmployeeRequest(
        @NotBlank
        @Size(max = 100)
        String name,
        @NotBlank
        @Size(max = 128)
        String pin,
        @NotNull
        EmployeeRole role
) {

    @Override
    public String toString() {
        return "CreateEmployeeRequest[name=" + name + ", role=" + role + "]";
    }
}
