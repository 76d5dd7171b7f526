package com.facet.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.SessionKind;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Immutable
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "action_type", nullable = false, length = 64)
    private String actionType;

    @Column(name = "resource_type", nullable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, length = 128)
    private String resourceKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_kind", length = 16)
    private SessionKind actorKind;

    @Column(name = "actor_employee_id", columnDefinition = "uuid")
    private UUID actorEmployeeId;

    @Column(name = "actor_session_id", columnDefinition = "uuid")
    private UUID actorSessionId;

    @Column(name = "request_id", length = 64)
    private String requestId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", columnDefinition = "jsonb")
    private Map<String, Object> detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public AuditLog(String actionType, String resourceType, String resourceKey, OffsetDateTime createdAt) {
        this.actionType = actionType;
        this.resourceType = resourceType;
        this.resourceKey = resourceKey;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public SessionKind getActorKind() {
        return actorKind;
    }

    public UUID getActorEmployeeId() {
        return actorEmployeeId;
    }

    public UUID getActorSessionId() {
        return actorSessionId;
    }

    public void setActor(SessionKind actorKind, UUID actorEmployeeId, UUID actorSessionId) {
        this.actorKind = actorKind;
        this.actorEmployeeId = actorEmployeeId;
        this.actorSessionId = actorSessionId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public void setDetail(Map<String, Object> detail) {
        this.detail = detail;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
