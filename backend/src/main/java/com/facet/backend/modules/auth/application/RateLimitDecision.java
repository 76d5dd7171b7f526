package com.facet.backend.modules.auth.application;

import java.time.Duration;

public record RateLimitDecision(boolean allowed, Duration retryAfter) {

    private static final RateLimitDecision ALLOW = new RateLimitDecision(true, Duration.ZERO);

    public static RateLimitDecision allow() {
        return ALLOW;
    }

    public static RateLimitDecision deny(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter);
    }

    /**
     * Whole seconds to put in {@code Retry-After}, rounded up and never below one for a rejection.
     */
    public long retryAfterSeconds() {
        if (allowed) {
            return 0;
        }
        long seconds = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(1, seconds);
    }
}
