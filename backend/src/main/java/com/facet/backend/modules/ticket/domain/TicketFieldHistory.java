package com.facet.backend.modules.ticket.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * One changed field. Values are stored as text; {@code null} means the field was empty.
 */
@Entity
@Immutable
@Table(name = "ticket_field_history")
public class TicketFieldHistory {

    @Id
    @UuidGenerator
    @Column(name = "history_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "ticket_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ticketId;

    @Column(name = "field_name", nullable = false, updatable = false, length = 64)
    private String fieldName;

    @Column(name = "old_value", updatable = false, length = 2000)
    private String oldValue;

    @Column(name = "new_value", updatable = false, length = 2000)
    private String newValue;

    @Column(name = "changed_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID changedBy;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private OffsetDateTime changedAt;

    protected TicketFieldHistory() {
    }

    public TicketFieldHistory(UUID ticketId, String fieldName, String oldValue, String newValue, UUID changedBy,
                              OffsetDateTime changedAt) {
        this.ticketId = ticketId;
        this.fieldName = fieldName;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.changedBy = changedBy;
        this.changedAt = changedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTicketId() {
        return ticketId;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getOldValue() {
        return oldValue;
    }

    public String getNewValue() {
        return newValue;
    }

    public UUID getChangedBy() {
        return changedBy;
    }

    public OffsetDateTime getChangedAt() {
        return changedAt;
    }
}
