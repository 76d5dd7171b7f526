package com.facet.backend.global.security;

import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static SessionPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof SessionPrincipal principal)) {
            throw ProblemException.unauthorized("A valid session is required");
        }
        return principal;
    }
}
