package com.facet.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

/**
 * Identity resolved from a validated session token.
 * Admin-session principals carry no employee id and always act with the admin role.
 */
public record SessionPrincipal(
        SessionKind kind,
        UUID sessionId,
        UUID employeeId,
        String displayName,
        EmployeeRole role,
        OffsetDateTime expiresAt
) {

    public static SessionPrincipal admin(UUID sessionId, OffsetDateTime expiresAt) {
        return new SessionPrincipal(SessionKind.ADMIN, sessionId, null, "admin", EmployeeRole.ADMIN, expiresAt);
    }

    public static SessionPrincipal employee(UUID sessionId, Employee employee, OffsetDateTime expiresAt) {
        return new SessionPrincipal(SessionKind.EMPLOYEE, sessionId, employee.getId(), employee.getName(),
                employee.getRole(), expiresAt);
    }

    public boolean isAdmin() {
        return role == EmployeeRole.ADMIN;
    }

    public Set<Permission> permissions() {
        return RolePermissions.permissionsFor(role);
    }

    public boolean has(Permission permission) {
        return RolePermissions.has(role, permission);
    }
}
