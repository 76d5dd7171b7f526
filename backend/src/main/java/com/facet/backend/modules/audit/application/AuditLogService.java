package com.facet.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.facet.backend.global.common.LogSanitizer;
import com.facet.backend.global.web.RequestIdFilter;
import com.facet.backend.modules.audit.domain.AuditLog;
import com.facet.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.facet.backend.modules.auth.domain.SessionPrincipal;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends administrative actions to the audit log inside the caller's transaction,
 * so an action and its audit row commit or roll back together.
 */
@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog(command.actionType(), command.resourceType(), command.resourceKey(),
                OffsetDateTime.now(clock));

        SessionPrincipal actor = command.actor();
        if (actor != null) {
            auditLog.setActor(actor.kind(), actor.employeeId(), actor.sessionId());
        }
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));

        if (command.detail() != null && !command.detail().isEmpty()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            command.detail().forEach((key, value) -> detail.put(key, sanitizeValue(value)));
            auditLog.setDetail(detail);
        }

        auditLogRepository.save(auditLog);
    }

    private static Object sanitizeValue(Object value) {
        if (value instanceof String text) {
            return LogSanitizer.sanitize(text, 512);
        }
        return value;
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            SessionPrincipal actor,
            Map<String, Object> detail
    ) {
    }
}
