package com.facet.backend.modules.auth.application;

import java.util.Objects;

import com.facet.backend.modules.auth.domain.OwnedResource;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

/**
 * Decides whether a principal may act on an owned record: admins always may, anyone else
 * only when they took it in or are working on it.
 */
public final class OwnershipResolver {

    private OwnershipResolver() {
    }

    public static boolean canAct(SessionPrincipal principal, OwnedResource resource) {
        if (principal == null || resource == null) {
            return false;
        }
        if (principal.isAdmin()) {
            return true;
        }
        if (principal.employeeId() == null) {
            return false;
        }
        return Objects.equals(principal.employeeId(), resource.getTakenInBy())
                || Objects.equals(principal.employeeId(), resource.getWorkedBy());
    }
}
