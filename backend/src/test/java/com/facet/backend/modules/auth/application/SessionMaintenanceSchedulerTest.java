package com.facet.backend.modules.auth.application;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionMaintenanceSchedulerTest {

    @Mock
    private SessionStore sessionStore;

    @Mock
    private LoginRateLimiter loginRateLimiter;

    @InjectMocks
    private SessionMaintenanceScheduler scheduler;

    @Test
    void sweepsSessionsAndEvictsIdleSources() {
        when(sessionStore.sweepExpired()).thenReturn(new SessionSweepResult(2, 3));
        when(loginRateLimiter.evictIdle()).thenReturn(1);

        scheduler.sweep();

        verify(sessionStore).sweepExpired();
        verify(loginRateLimiter).evictIdle();
    }

    @Test
    void quietSweepStillEvicts() {
        when(sessionStore.sweepExpired()).thenReturn(new SessionSweepResult(0, 0));
        when(loginRateLimiter.evictIdle()).thenReturn(0);

        scheduler.sweep();

        verify(loginRateLimiter).evictIdle();
    }
}
