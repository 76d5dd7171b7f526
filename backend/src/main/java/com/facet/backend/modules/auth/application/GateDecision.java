package com.facet.backend.modules.auth.application;

import java.util.Set;

import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

/**
 * Outcome of gating a request: either proceed with a principal and its permissions, or reject.
 */
public record GateDecision(SessionPrincipal principal, Set<Permission> permissions, Rejection rejection) {

    public enum Rejection {
        UNAUTHORIZED,
        FORBIDDEN
    }

    public static GateDecision proceed(SessionPrincipal principal) {
        return new GateDecision(principal, principal.permissions(), null);
    }

    public static GateDecision reject(Rejection rejection) {
        return new GateDecision(null, Set.of(), rejection);
    }

    public boolean proceeds() {
        return rejection == null;
    }

    public SessionPrincipal orThrow() {
        if (rejection == null) {
            return principal;
        }
        throw switch (rejection) {
            case UNAUTHORIZED -> ProblemException.unauthorized("A valid session is required");
            case FORBIDDEN -> ProblemException.forbidden("Not permitted to perform this action");
        };
    }
}
