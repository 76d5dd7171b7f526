package com.facet.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceScheduler.class);

    private final SessionStore sessionStore;
    private final LoginRateLimiter loginRateLimiter;

    public SessionMaintenanceScheduler(SessionStore sessionStore, LoginRateLimiter loginRateLimiter) {
        this.sessionStore = sessionStore;
        this.loginRateLimiter = loginRateLimiter;
    }

    @Scheduled(fixedDelayString = "${facet.session.sweep-interval:PT5M}")
    public void sweep() {
        SessionSweepResult result = sessionStore.sweepExpired();
        if (result.total() > 0) {
            log.info("Removed {} expired admin and {} expired employee session(s)",
                    result.adminSessions(), result.employeeSessions());
        }
        int evicted = loginRateLimiter.evictIdle();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate-limit entries", evicted);
        }
    }
}
