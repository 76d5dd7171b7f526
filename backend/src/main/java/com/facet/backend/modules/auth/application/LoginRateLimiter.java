package com.facet.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-source throttle for PIN verification combining a sliding-window cap with an
 * escalating backoff on consecutive failures.
 *
 * <p>Every read-modify-write of a source's state runs inside {@link ConcurrentMap#compute},
 * so concurrent attempts from one source can never both observe a free slot.</p>
 */
@Component
public class LoginRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(LoginRateLimiter.class);

    private final ConcurrentMap<String, AttemptState> states = new ConcurrentHashMap<>();
    private final RateLimitProperties properties;
    private final Clock clock;

    public LoginRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Admits or rejects an attempt. An admitted attempt consumes a window slot immediately.
     */
    public RateLimitDecision check(String sourceKey) {
        Instant now = clock.instant();
        RateLimitDecision[] decision = new RateLimitDecision[1];
        states.compute(sourceKey, (key, existing) -> {
            AttemptState state = existing != null ? existing : new AttemptState();
            decision[0] = state.tryAcquire(now, properties.maxAttempts(), properties.window());
            return state;
        });
        if (!decision[0].allowed()) {
            log.warn("Throttled authentication attempt; retry in {}s", decision[0].retryAfterSeconds());
        }
        return decision[0];
    }

    public void recordFailure(String sourceKey) {
        Instant now = clock.instant();
        states.compute(sourceKey, (key, existing) -> {
            AttemptState state = existing != null ? existing : new AttemptState();
            state.registerFailure(now, properties);
            return state;
        });
    }

    /**
     * Clears the failure streak and backoff. Window slots already spent stay spent.
     */
    public void recordSuccess(String sourceKey) {
        states.computeIfPresent(sourceKey, (key, state) -> {
            state.resetFailures(clock.instant());
            return state;
        });
    }

    /**
     * Forgets sources with no recent activity and no pending backoff.
     */
    public int evictIdle() {
        Instant now = clock.instant();
        Instant idleBefore = now.minus(properties.idleEviction());
        int[] evicted = new int[1];
        for (String key : states.keySet()) {
            states.computeIfPresent(key, (k, state) -> {
                if (state.isIdle(now, idleBefore, properties.window())) {
                    evicted[0]++;
                    return null;
                }
                return state;
            });
        }
        return evicted[0];
    }

    int trackedSources() {
        return states.size();
    }

    /**
     * Mutated only inside map compute functions.
     */
    private static final class AttemptState {

        private final Deque<Instant> admitted = new ArrayDeque<>();
        private int consecutiveFailures;
        private Instant nextAllowedAt;
        private Instant lastSeenAt;

        RateLimitDecision tryAcquire(Instant now, int maxAttempts, Duration window) {
            lastSeenAt = now;
            prune(now, window);

            Duration backoffWait = Duration.ZERO;
            if (nextAllowedAt != null && now.isBefore(nextAllowedAt)) {
                backoffWait = Duration.between(now, nextAllowedAt);
            }
            Duration windowWait = Duration.ZERO;
            if (admitted.size() >= maxAttempts) {
                windowWait = Duration.between(now, admitted.peekFirst().plus(window));
            }

            if (backoffWait.isZero() && windowWait.isZero()) {
                admitted.addLast(now);
                return RateLimitDecision.allow();
            }
            return RateLimitDecision.deny(backoffWait.compareTo(windowWait) >= 0 ? backoffWait : windowWait);
        }

        void registerFailure(Instant now, RateLimitProperties properties) {
            lastSeenAt = now;
            consecutiveFailures++;
            Instant candidate = now.plus(properties.backoffAfter(consecutiveFailures));
            // never shorten a backoff that is already in force
            if (nextAllowedAt == null || candidate.isAfter(nextAllowedAt)) {
                nextAllowedAt = candidate;
            }
        }

        void resetFailures(Instant now) {
            lastSeenAt = now;
            consecutiveFailures = 0;
            nextAllowedAt = null;
        }

        boolean isIdle(Instant now, Instant idleBefore, Duration window) {
            prune(now, window);
            boolean backoffPending = nextAllowedAt != null && now.isBefore(nextAllowedAt);
            return !backoffPending && admitted.isEmpty() && lastSeenAt != null && lastSeenAt.isBefore(idleBefore);
        }

        private void prune(Instant now, Duration window) {
            Instant windowStart = now.minus(window);
            while (!admitted.isEmpty() && !admitted.peekFirst().isAfter(windowStart)) {
                admitted.pollFirst();
            }
        }
    }
}
