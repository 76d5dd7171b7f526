package com.facet.backend.modules.admin.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.facet.backend.global.error.ProblemCode;
import com.facet.backend.global.error.ProblemException;
import com.facet.backend.global.error.RetryableProblemException;
import com.facet.backend.modules.admin.domain.StoreSettings;
import com.facet.backend.modules.admin.infrastructure.persistence.StoreSettingsRepository;
import com.facet.backend.modules.admin.presentation.dto.ChangeAdminPinRequest;
import com.facet.backend.modules.admin.presentation.dto.StoreSettingsResponse;
import com.facet.backend.modules.admin.presentation.dto.UpdateStoreSettingsRequest;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.facet.backend.modules.auth.application.LoginRateLimiter;
import com.facet.backend.modules.auth.application.PinHasher;
import com.facet.backend.modules.auth.application.PinPolicy;
import com.facet.backend.modules.auth.application.PinProperties;
import com.facet.backend.modules.auth.application.RateLimitDecision;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.application.SessionStore;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class StoreSettingsService {

    private static final Logger log = LoggerFactory.getLogger(StoreSettingsService.class);
    private static final String RESOURCE_TYPE = "STORE_SETTINGS";

    private final StoreSettingsRepository storeSettingsRepository;
    private final PinHasher pinHasher;
    private final PinProperties pinProperties;
    private final LoginRateLimiter loginRateLimiter;
    private final SessionStore sessionStore;
    private final RequestGate requestGate;
    private final AuditLogService auditLogService;

    public StoreSettingsService(
            StoreSettingsRepository storeSettingsRepository,
            PinHasher pinHasher,
            PinProperties pinProperties,
            LoginRateLimiter loginRateLimiter,
            SessionStore sessionStore,
            RequestGate requestGate,
            AuditLogService auditLogService
    ) {
        this.storeSettingsRepository = storeSettingsRepository;
        this.pinHasher = pinHasher;
        this.pinProperties = pinProperties;
        this.loginRateLimiter = loginRateLimiter;
        this.sessionStore = sessionStore;
        this.requestGate = requestGate;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public StoreSettingsResponse getSettings(SessionPrincipal actor) {
        requestGate.authorize(actor, Permission.MANAGE_SETTINGS).orThrow();
        return StoreSettingsResponse.from(loadSettings());
    }

    public StoreSettingsResponse updateSettings(SessionPrincipal actor, @NonNull UpdateStoreSettingsRequest request) {
        requestGate.authorize(actor, Permission.MANAGE_SETTINGS).orThrow();
        StoreSettings settings = loadSettingsForUpdate();
        Map<String, Object> changes = new LinkedHashMap<>();

        if (request.storeName() != null && !request.storeName().equals(settings.getStoreName())) {
            if (request.storeName().isBlank()) {
                throw ProblemException.validation("Store name must not be blank");
            }
            settings.setStoreName(request.storeName().strip());
            changes.put("storeName", settings.getStoreName());
        }
        if (request.storePhone() != null && !request.storePhone().equals(settings.getStorePhone())) {
            settings.setStorePhone(request.storePhone());
            changes.put("storePhone", request.storePhone());
        }
        if (request.storeAddress() != null && !request.storeAddress().equals(settings.getStoreAddress())) {
            settings.setStoreAddress(request.storeAddress());
            changes.put("storeAddress", request.storeAddress());
        }
        if (request.currency() != null && !request.currency().equals(settings.getCurrency())) {
            settings.setCurrency(request.currency());
            changes.put("currency", request.currency());
        }
        if (request.ticketPrefix() != null && !request.ticketPrefix().equals(settings.getTicketPrefix())) {
            settings.setTicketPrefix(request.ticketPrefix());
            changes.put("ticketPrefix", request.ticketPrefix());
        }
        if (request.maxPhotosPerTicket() != null && request.maxPhotosPerTicket() != settings.getMaxPhotosPerTicket()) {
            settings.setMaxPhotosPerTicket(request.maxPhotosPerTicket());
            changes.put("maxPhotosPerTicket", request.maxPhotosPerTicket());
        }

        if (!changes.isEmpty()) {
            auditLogService.record(new AuditLogCommand("SETTINGS_UPDATED", RESOURCE_TYPE, settings.getId().toString(),
                    actor, changes));
        }
        return StoreSettingsResponse.from(settings);
    }

    /**
     * Replaces the admin PIN and ends every other admin session. The calling session stays valid.
     */
    public void changeAdminPin(SessionPrincipal actor, @NonNull ChangeAdminPinRequest request, String currentToken) {
        requestGate.authorize(actor, Permission.MANAGE_SETTINGS).orThrow();

        String sourceKey = "admin-pin-change:" + actor.sessionId();
        RateLimitDecision decision = loginRateLimiter.check(sourceKey);
        if (!decision.allowed()) {
            throw new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, ProblemCode.RATE_LIMITED,
                    "Too many attempts, try again later", decision.retryAfterSeconds());
        }

        StoreSettings settings = loadSettingsForUpdate();
        if (!pinHasher.verify(request.currentPin(), settings.getAdminPinHash())) {
            loginRateLimiter.recordFailure(sourceKey);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, ProblemCode.INVALID_PIN, "Current PIN is incorrect");
        }
        loginRateLimiter.recordSuccess(sourceKey);

        String reason = PinPolicy.validateAndReason(request.newPin(), pinProperties.minLength());
        if (reason != null) {
            throw ProblemException.validation(reason);
        }

        settings.setAdminPinHash(pinHasher.hash(request.newPin()));
        settings.setSetupComplete(true);
        int revoked = sessionStore.revokeOtherAdminSessions(currentToken);

        auditLogService.record(new AuditLogCommand("ADMIN_PIN_CHANGED", RESOURCE_TYPE, settings.getId().toString(),
                actor, Map.of("revokedSessions", revoked)));
        log.info("Admin PIN changed; revoked {} other admin session(s)", revoked);
    }

    /**
     * Allocates the next friendly ticket code under a row lock held until the caller commits.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String allocateTicketCode() {
        return loadSettingsForUpdate().allocateTicketCode();
    }

    @Transactional(readOnly = true)
    public int maxPhotosPerTicket() {
        return storeSettingsRepository.findSingleton()
                .map(StoreSettings::getMaxPhotosPerTicket)
                .orElse(StoreSettings.DEFAULT_MAX_PHOTOS_PER_TICKET);
    }

    private StoreSettings loadSettings() {
        return storeSettingsRepository.findSingleton()
                .orElseThrow(() -> ProblemException.notFound("Store settings are not initialised"));
    }

    private StoreSettings loadSettingsForUpdate() {
        return storeSettingsRepository.findSingletonForUpdate()
                .orElseThrow(() -> ProblemException.notFound("Store settings are not initialised"));
    }
}
