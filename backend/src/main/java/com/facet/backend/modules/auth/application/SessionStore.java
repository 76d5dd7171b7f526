package com.facet.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.AdminSession;
import com.facet.backend.modules.auth.domain.Employee;
import com.facet.backend.modules.auth.domain.EmployeeSession;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.auth.infrastructure.persistence.AdminSessionRepository;
import com.facet.backend.modules.auth.infrastructure.persistence.EmployeeSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Issues, validates, slides and revokes admin and employee sessions.
 *
 * <p>Validation and expiry extension happen in a single conditional UPDATE, so a session that is
 * revoked concurrently is never extended and then reported as valid.</p>
 */
@Service
@Transactional
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final AdminSessionRepository adminSessionRepository;
    private final EmployeeSessionRepository employeeSessionRepository;
    private final SessionProperties sessionProperties;
    private final Clock clock;

    public SessionStore(
            AdminSessionRepository adminSessionRepository,
            EmployeeSessionRepository employeeSessionRepository,
            SessionProperties sessionProperties,
            Clock clock
    ) {
        this.adminSessionRepository = adminSessionRepository;
        this.employeeSessionRepository = employeeSessionRepository;
        this.sessionProperties = sessionProperties;
        this.clock = clock;
    }

    public IssuedSession issueAdminSession() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = SessionTokens.newToken();
        AdminSession session = new AdminSession(SessionTokens.digest(token), now,
                now.plus(sessionProperties.idleTimeout(SessionKind.ADMIN)));
        adminSessionRepository.save(session);
        log.info("Issued admin session {}", session.getId());
        return new IssuedSession(SessionKind.ADMIN, session.getId(), token, session.getExpiresAt());
    }

    public IssuedSession issueEmployeeSession(Employee employee) {
        Objects.requireNonNull(employee, "employee");
        if (!employee.isActive()) {
            throw new IllegalStateException("Cannot issue a session for an inactive employee");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = SessionTokens.newToken();
        EmployeeSession session = new EmployeeSession(employee, SessionTokens.digest(token), now,
                now.plus(sessionProperties.idleTimeout(SessionKind.EMPLOYEE)));
        employeeSessionRepository.save(session);
        log.info("Issued employee session {} for employee {}", session.getId(), employee.getId());
        return new IssuedSession(SessionKind.EMPLOYEE, session.getId(), token, session.getExpiresAt());
    }

    /**
     * Resolves a token to its principal and slides its expiry forward by the idle window.
     * Expired or orphaned rows found on the way are deleted.
     */
    public Optional<SessionPrincipal> validateAndTouch(String token, SessionKind kind) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        String tokenHash = SessionTokens.digest(token.trim());
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = now.plus(sessionProperties.idleTimeout(kind));

        return switch (kind) {
            case ADMIN -> {
                if (adminSessionRepository.touch(tokenHash, now, expiresAt) == 0) {
                    adminSessionRepository.deleteByTokenHash(tokenHash);
                    yield Optional.empty();
                }
                yield adminSessionRepository.findByTokenHash(tokenHash)
                        .map(session -> SessionPrincipal.admin(session.getId(), session.getExpiresAt()));
            }
            case EMPLOYEE -> {
                if (employeeSessionRepository.touchForActiveEmployee(tokenHash, now, expiresAt) == 0) {
                    employeeSessionRepository.deleteByTokenHash(tokenHash);
                    yield Optional.empty();
                }
                yield employeeSessionRepository.findWithEmployeeByTokenHash(tokenHash)
                        .map(session -> SessionPrincipal.employee(session.getId(), session.getEmployee(),
                                session.getExpiresAt()));
            }
        };
    }

    /**
     * Idempotent: revoking an unknown or already revoked token is not an error.
     */
    public boolean revoke(String token, SessionKind kind) {
        if (!StringUtils.hasText(token)) {
            return false;
        }
        String tokenHash = SessionTokens.digest(token.trim());
        int deleted = switch (kind) {
            case ADMIN -> adminSessionRepository.deleteByTokenHash(tokenHash);
            case EMPLOYEE -> employeeSessionRepository.deleteByTokenHash(tokenHash);
        };
        return deleted > 0;
    }

    public int revokeAllForEmployee(UUID employeeId) {
        int deleted = employeeSessionRepository.deleteAllByEmployeeId(employeeId);
        if (deleted > 0) {
            log.info("Revoked {} session(s) for employee {}", deleted, employeeId);
        }
        return deleted;
    }

    public int revokeOtherAdminSessions(String keepToken) {
        String keepHash = StringUtils.hasText(keepToken) ? SessionTokens.digest(keepToken.trim()) : "";
        return adminSessionRepository.deleteAllExcept(keepHash);
    }

    public SessionSweepResult sweepExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int admin = adminSessionRepository.deleteExpired(now);
        int employee = employeeSessionRepository.deleteExpired(now);
        return new SessionSweepResult(admin, employee);
    }
}
