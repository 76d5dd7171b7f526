package com.facet.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.EmployeeRole;

public record EmployeeSessionResponse(
        String sessionToken,
        OffsetDateTime expiresAt,
        UUID employeeId,
        String name,
        EmployeeRole role
) {
}
