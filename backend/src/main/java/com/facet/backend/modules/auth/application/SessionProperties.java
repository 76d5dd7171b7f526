package com.facet.backend.modules.auth.application;

import java.time.Duration;

import com.facet.backend.modules.auth.domain.SessionKind;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "facet.session")
public record SessionProperties(
        @DefaultValue("PT30M") Duration adminIdleTimeout,
        @DefaultValue("PT8H") Duration employeeIdleTimeout
) {

    public SessionProperties {
        requirePositive(adminIdleTimeout, "admin-idle-timeout");
        requirePositive(employeeIdleTimeout, "employee-idle-timeout");
    }

    public Duration idleTimeout(SessionKind kind) {
        return switch (kind) {
            case ADMIN -> adminIdleTimeout;
            case EMPLOYEE -> employeeIdleTimeout;
        };
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException("facet.session." + name + " must be positive");
        }
    }
}
