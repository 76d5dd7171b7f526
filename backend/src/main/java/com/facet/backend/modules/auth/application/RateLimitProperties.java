package com.facet.backend.modules.auth.application;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param maxAttempts   attempts admitted per source within {@code window}
 * @param backoff       delay after the n-th consecutive failure; the last entry repeats
 * @param idleEviction  how long an untouched source is kept before the sweep forgets it
 */
@ConfigurationProperties(prefix = "facet.rate-limit")
public record RateLimitProperties(
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("PT60S") Duration window,
        @DefaultValue({"PT0S", "PT5S", "PT30S", "PT300S"}) List<Duration> backoff,
        @DefaultValue("PT1H") Duration idleEviction
) {

    public RateLimitProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("facet.rate-limit.max-attempts must be at least 1");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("facet.rate-limit.window must be positive");
        }
        if (backoff == null || backoff.isEmpty()) {
            throw new IllegalArgumentException("facet.rate-limit.backoff must not be empty");
        }
        backoff = List.copyOf(backoff);
    }

    public static RateLimitProperties defaults() {
        return new RateLimitProperties(5, Duration.ofSeconds(60),
                List.of(Duration.ZERO, Duration.ofSeconds(5), Duration.ofSeconds(30), Duration.ofSeconds(300)),
                Duration.ofHours(1));
    }

    Duration backoffAfter(int consecutiveFailures) {
        if (consecutiveFailures <= 0) {
            return Duration.ZERO;
        }
        return backoff.get(Math.min(consecutiveFailures, backoff.size()) - 1);
    }
}
