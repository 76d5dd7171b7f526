package com.facet.backend.modules.admin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.global.error.ProblemCode;
import com.facet.backend.global.error.ProblemException;
import com.facet.backend.global.error.RetryableProblemException;
import com.facet.backend.modules.admin.domain.StoreSettings;
import com.facet.backend.modules.admin.infrastructure.persistence.StoreSettingsRepository;
import com.facet.backend.modules.admin.presentation.dto.ChangeAdminPinRequest;
import com.facet.backend.modules.admin.presentation.dto.StoreSettingsResponse;
import com.facet.backend.modules.admin.presentation.dto.UpdateStoreSettingsRequest;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.auth.application.LoginRateLimiter;
import com.facet.backend.modules.auth.application.PinHasher;
import com.facet.backend.modules.auth.application.PinProperties;
import com.facet.backend.modules.auth.application.RateLimitProperties;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.application.SessionStore;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.support.MutableClock;
import com.facet.backend.support.TestEmployees;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class StoreSettingsServiceTest {

    @Mock
    private StoreSettingsRepository storeSettingsRepository;

    @Mock
    private PinHasher pinHasher;

    @Mock
    private SessionStore sessionStore;

    @Mock
    private AuditLogService auditLogService;

    private StoreSettingsService service;
    private StoreSettings settings;
    private SessionPrincipal adminSession;

    @BeforeEach
    void setUp() {
        LoginRateLimiter limiter = new LoginRateLimiter(RateLimitProperties.defaults(),
                new MutableClock(Instant.parse("2025-03-01T09:00:00Z")));
        service = new StoreSettingsService(storeSettingsRepository, pinHasher, new PinProperties(6), limiter,
                sessionStore, new RequestGate(sessionStore), auditLogService);
        settings = new StoreSettings();
        ReflectionTestUtils.setField(settings, "id", UUID.randomUUID());
        settings.setStoreName("Facet Jewelry");
        settings.setAdminPinHash("old-hash");
        adminSession = TestEmployees.adminSession();
    }

    @Test
    void changeAdminPinKeepsCallerAndRevokesOtherAdminSessions() {
        when(storeSettingsRepository.findSingletonForUpdate()).thenReturn(Optional.of(settings));
        when(pinHasher.verify("482917", "old-hash")).thenReturn(true);
        when(pinHasher.hash("730218")).thenReturn("new-hash");
        when(sessionStore.revokeOtherAdminSessions("caller-token")).thenReturn(1);

        service.changeAdminPin(adminSession, new ChangeAdminPinRequest("482917", "730218"), "caller-token");

        assertThat(settings.getAdminPinHash()).isEqualTo("new-hash");
        assertThat(settings.isSetupComplete()).isTrue();
        verify(auditLogService).record(any());
    }

    @Test
    void wrongCurrentPinIsRejectedAndThrottled() {
        when(storeSettingsRepository.findSingletonForUpdate()).thenReturn(Optional.of(settings));
        when(pinHasher.verify("000999", "old-hash")).thenReturn(false);
        ChangeAdminPinRequest wrong = new ChangeAdminPinRequest("000999", "730218");

        assertThatThrownBy(() -> service.changeAdminPin(adminSession, wrong, "caller-token"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.INVALID_PIN));
        assertThatThrownBy(() -> service.changeAdminPin(adminSession, wrong, "caller-token"))
                .isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> service.changeAdminPin(adminSession, wrong, "caller-token"))
                .isInstanceOf(RetryableProblemException.class);
        verify(pinHasher, never()).hash(anyString());
        verify(sessionStore, never()).revokeOtherAdminSessions(anyString());
    }

    @Test
    void weakNewPinIsRejected() {
        when(storeSettingsRepository.findSingletonForUpdate()).thenReturn(Optional.of(settings));
        when(pinHasher.verify("482917", "old-hash")).thenReturn(true);

        assertThatThrownBy(() -> service.changeAdminPin(adminSession,
                new ChangeAdminPinRequest("482917", "111111"), "caller-token"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.VALIDATION_ERROR));
        assertThat(settings.getAdminPinHash()).isEqualTo("old-hash");
    }

    @Test
    void updateSettingsAuditsOnlyChangedValues() {
        when(storeSettingsRepository.findSingletonForUpdate()).thenReturn(Optional.of(settings));

        StoreSettingsResponse response = service.updateSettings(adminSession,
                new UpdateStoreSettingsRequest("Facet Jewelry", "555-0100", null, null, null, 4));

        assertThat(response.maxPhotosPerTicket()).isEqualTo(4);
        assertThat(settings.getStorePhone()).isEqualTo("555-0100");
        verify(auditLogService).record(any());
    }

    @Test
    void photoLimitFallsBackToDefaultWithoutSettings() {
        when(storeSettingsRepository.findSingleton()).thenReturn(Optional.empty());

        assertThat(service.maxPhotosPerTicket()).isEqualTo(StoreSettings.DEFAULT_MAX_PHOTOS_PER_TICKET);
    }
}
