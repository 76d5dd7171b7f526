package com.facet.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.Employee;
import com.facet.backend.modules.auth.domain.EmployeeRole;

public record EmployeeResponse(
        UUID employeeId,
        String name,
        EmployeeRole role,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static EmployeeResponse from(Employee employee) {
        return new EmployeeResponse(employee.getId(), employee.getName(), employee.getRole(), employee.isActive(),
                employee.getCreatedAt(), employee.getUpdatedAt());
    }
}
