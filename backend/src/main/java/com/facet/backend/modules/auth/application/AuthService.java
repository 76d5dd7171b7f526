package com.facet.backend.modules.auth.application;

import java.util.List;

import com.facet.backend.global.error.ProblemCode;
import com.facet.backend.global.error.ProblemException;
import com.facet.backend.global.error.RetryableProblemException;
import com.facet.backend.modules.admin.domain.StoreSettings;
import com.facet.backend.modules.admin.infrastructure.persistence.StoreSettingsRepository;
import com.facet.backend.modules.auth.domain.Employee;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.modules.auth.infrastructure.persistence.EmployeeRepository;
import com.facet.backend.modules.auth.presentation.dto.AdminSessionResponse;
import com.facet.backend.modules.auth.presentation.dto.EmployeeSessionResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * PIN verification for both session families. The throttle is consulted before any hash is
 * computed, so a rejected attempt costs no key-derivation work.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final EmployeeRepository employeeRepository;
    private final StoreSettingsRepository storeSettingsRepository;
    private final PinHasher pinHasher;
    private final LoginRateLimiter loginRateLimiter;
    private final SessionStore sessionStore;

    public AuthService(
            EmployeeRepository employeeRepository,
            StoreSettingsRepository storeSettingsRepository,
            PinHasher pinHasher,
            LoginRateLimiter loginRateLimiter,
            SessionStore sessionStore
    ) {
        this.employeeRepository = employeeRepository;
        this.storeSettingsRepository = storeSettingsRepository;
        this.pinHasher = pinHasher;
        this.loginRateLimiter = loginRateLimiter;
        this.sessionStore = sessionStore;
    }

    public AdminSessionResponse verifyAdminPin(String pin, String sourceKey) {
        guardAttempt(sourceKey);

        String storedHash = storeSettingsRepository.findSingleton()
                .map(StoreSettings::getAdminPinHash)
                .orElse(null);
        if (!pinHasher.verify(pin, storedHash)) {
            loginRateLimiter.recordFailure(sourceKey);
            log.warn("Admin PIN verification failed");
            throw invalidPin();
        }

        loginRateLimiter.recordSuccess(sourceKey);
        IssuedSession session = sessionStore.issueAdminSession();
        return new AdminSessionResponse(session.token(), session.expiresAt());
    }

    public EmployeeSessionResponse verifyEmployeePin(String pin, String sourceKey) {
        guardAttempt(sourceKey);

        List<Employee> candidates = employeeRepository.findByActiveTrueOrderByCreatedAtAsc();
        Employee matched = null;
        for (Employee candidate : candidates) {
            if (pinHasher.verify(pin, candidate.getPinHash())) {
                matched = candidate;
                break;
            }
        }
        if (matched == null) {
            loginRateLimiter.recordFailure(sourceKey);
            log.warn("Employee PIN verification failed");
            throw invalidPin();
        }

        loginRateLimiter.recordSuccess(sourceKey);
        IssuedSession session = sessionStore.issueEmployeeSession(matched);
        return new EmployeeSessionResponse(session.token(), session.expiresAt(), matched.getId(),
                matched.getName(), matched.getRole());
    }

    public void logout(String token, SessionKind kind) {
        // Same response whether or not the token existed
        sessionStore.revoke(token, kind);
    }

    private void guardAttempt(String sourceKey) {
        RateLimitDecision decision = loginRateLimiter.check(sourceKey);
        if (!decision.allowed()) {
            throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, ProblemCode.RATE_LIMITED,
                    "Too many attempts, try again later", decision.retryAfterSeconds());
        }
    }

    private static ProblemException invalidPin() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, ProblemCode.INVALID_PIN, "PIN not recognised");
    }
}
