package com.facet.backend.modules.ticket.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * One status change. Rows are never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "ticket_status_history")
public class TicketStatusHistory {

    @Id
    @UuidGenerator
    @Column(name = "history_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "ticket_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ticketId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", updatable = false, length = 32)
    private TicketStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, updatable = false, length = 32)
    private TicketStatus toStatus;

    @Column(name = "changed_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID changedBy;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private OffsetDateTime changedAt;

    protected TicketStatusHistory() {
    }

    public TicketStatusHistory(UUID ticketId, TicketStatus fromStatus, TicketStatus toStatus, UUID changedBy,
                               OffsetDateTime changedAt) {
        this.ticketId = ticketId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.changedBy = changedBy;
        this.changedAt = changedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTicketId() {
        return ticketId;
    }

    public TicketStatus getFromStatus() {
        return fromStatus;
    }

    public TicketStatus getToStatus() {
        return toStatus;
    }

    public UUID getChangedBy() {
        return changedBy;
    }

    public OffsetDateTime getChangedAt() {
        return changedAt;
    }
}
