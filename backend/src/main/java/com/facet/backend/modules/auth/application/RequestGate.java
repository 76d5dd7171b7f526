package com.facet.backend.modules.auth.application;

import com.facet.backend.modules.auth.domain.OwnedResource;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authentication and authorization checks shared by every protected operation.
 * Permission and ownership are independent: an owned-resource check requires both.
 */
@Component
public class RequestGate {

    private static final Logger log = LoggerFactory.getLogger(RequestGate.class);

    private final SessionStore sessionStore;

    public RequestGate(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    public GateDecision authenticate(SessionKind kind, String token) {
        return sessionStore.validateAndTouch(token, kind)
                .map(GateDecision::proceed)
                .orElseGet(() -> GateDecision.reject(GateDecision.Rejection.UNAUTHORIZED));
    }

    public GateDecision authorize(SessionPrincipal principal, Permission permission) {
        if (principal == null) {
            return GateDecision.reject(GateDecision.Rejection.UNAUTHORIZED);
        }
        if (!principal.has(permission)) {
            log.info("Denied {} to {} principal {}", permission, principal.role(), principal.sessionId());
            return GateDecision.reject(GateDecision.Rejection.FORBIDDEN);
        }
        return GateDecision.proceed(principal);
    }

    public GateDecision authorizeOwned(SessionPrincipal principal, OwnedResource resource, Permission permission) {
        GateDecision decision = authorize(principal, permission);
        if (!decision.proceeds()) {
            return decision;
        }
        if (!OwnershipResolver.canAct(principal, resource)) {
            log.info("Denied {} on a record not owned by employee {}", permission, principal.employeeId());
            return GateDecision.reject(GateDecision.Rejection.FORBIDDEN);
        }
        return decision;
    }
}
