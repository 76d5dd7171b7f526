package com.facet.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.facet.backend.modules.auth.domain.AdminSession;
import com.facet.backend.modules.auth.domain.Employee;
import com.facet.backend.modules.auth.domain.EmployeeRole;
import com.facet.backend.modules.auth.domain.EmployeeSession;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.auth.infrastructure.persistence.AdminSessionRepository;
import com.facet.backend.modules.auth.infrastructure.persistence.EmployeeSessionRepository;
import com.facet.backend.support.TestEmployees;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Mock
    private AdminSessionRepository adminSessionRepository;

    @Mock
    private EmployeeSessionRepository employeeSessionRepository;

    private SessionStore sessionStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        sessionStore = new SessionStore(adminSessionRepository, employeeSessionRepository,
                new SessionProperties(Duration.ofMinutes(30), Duration.ofHours(8)), clock);
    }

    @Test
    @DisplayName("only the token digest is persisted")
    void issueAdminSessionStoresDigestOnly() {
        IssuedSession issued = sessionStore.issueAdminSession();

        ArgumentCaptor<AdminSession> saved = ArgumentCaptor.forClass(AdminSession.class);
        verify(adminSessionRepository).save(saved.capture());
        assertThat(saved.getValue().getTokenHash())
                .isEqualTo(SessionTokens.digest(issued.token()))
                .isNotEqualTo(issued.token())
                .hasSize(64);
        assertThat(saved.getValue().getExpiresAt()).isEqualTo(NOW.plusMinutes(30));
        assertThat(issued.expiresAt()).isEqualTo(NOW.plusMinutes(30));
        assertThat(issued.toString()).doesNotContain(issued.token());
    }

    @Test
    void issuedTokensAreUnique() {
        assertThat(sessionStore.issueAdminSession().token()).isNotEqualTo(sessionStore.issueAdminSession().token());
    }

    @Test
    void refusesToIssueSessionForInactiveEmployee() {
        Employee employee = TestEmployees.employee("Alice", EmployeeRole.STAFF);
        employee.setActive(false);

        assertThatThrownBy(() -> sessionStore.issueEmployeeSession(employee))
                .isInstanceOf(IllegalStateException.class);
        verify(employeeSessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("validation slides the expiry by the idle window of the session kind")
    void validateAndTouchSlidesEmployeeExpiry() {
        Employee employee = TestEmployees.employee("Alice", EmployeeRole.STAFF);
        String token = "employee-token";
        String hash = SessionTokens.digest(token);
        EmployeeSession session = new EmployeeSession(employee, hash, NOW.minusHours(1), NOW.plusHours(8));
        when(employeeSessionRepository.touchForActiveEmployee(hash, NOW, NOW.plusHours(8))).thenReturn(1);
        when(employeeSessionRepository.findWithEmployeeByTokenHash(hash)).thenReturn(Optional.of(session));

        Optional<SessionPrincipal> principal = sessionStore.validateAndTouch(token, SessionKind.EMPLOYEE);

        assertThat(principal).isPresent();
        assertThat(principal.get().employeeId()).isEqualTo(employee.getId());
        assertThat(principal.get().role()).isEqualTo(EmployeeRole.STAFF);
        assertThat(principal.get().kind()).isEqualTo(SessionKind.EMPLOYEE);
    }

    @Test
    @DisplayName("expired, revoked or deactivated sessions are rejected and cleaned up")
    void validateAndTouchRejectsWhenNoRowIsTouched() {
        String hash = SessionTokens.digest("stale-token");
        when(employeeSessionRepository.touchForActiveEmployee(eq(hash), any(), any())).thenReturn(0);

        Optional<SessionPrincipal> principal = sessionStore.validateAndTouch("stale-token", SessionKind.EMPLOYEE);

        assertThat(principal).isEmpty();
        verify(employeeSessionRepository).deleteByTokenHash(hash);
        verify(employeeSessionRepository, never()).findWithEmployeeByTokenHash(anyString());
    }

    @Test
    void adminTokenIsNotAcceptedAsEmployeeToken() {
        IssuedSession admin = sessionStore.issueAdminSession();

        Optional<SessionPrincipal> principal = sessionStore.validateAndTouch(admin.token(), SessionKind.EMPLOYEE);

        assertThat(principal).isEmpty();
        verify(adminSessionRepository, never()).touch(anyString(), any(), any());
    }

    @Test
    void blankTokenIsRejectedWithoutQuery() {
        assertThat(sessionStore.validateAndTouch("  ", SessionKind.ADMIN)).isEmpty();
        assertThat(sessionStore.validateAndTouch(null, SessionKind.EMPLOYEE)).isEmpty();
        verify(adminSessionRepository, never()).touch(anyString(), any(), any());
    }

    @Test
    void revokeIsIdempotent() {
        String hash = SessionTokens.digest("gone");
        when(adminSessionRepository.deleteByTokenHash(hash)).thenReturn(1, 0);

        assertThat(sessionStore.revoke("gone", SessionKind.ADMIN)).isTrue();
        assertThat(sessionStore.revoke("gone", SessionKind.ADMIN)).isFalse();
        assertThat(sessionStore.revoke(null, SessionKind.ADMIN)).isFalse();
    }

    @Test
    void sweepDeletesExpiredRowsOfBothKinds() {
        when(adminSessionRepository.deleteExpired(NOW)).thenReturn(2);
        when(employeeSessionRepository.deleteExpired(NOW)).thenReturn(3);

        SessionSweepResult result = sessionStore.sweepExpired();

        assertThat(result.adminSessions()).isEqualTo(2);
        assertThat(result.employeeSessions()).isEqualTo(3);
        assertThat(result.total()).isEqualTo(5);
    }
}
