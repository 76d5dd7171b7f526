package com.facet.backend.modules.ticket.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Immutable
@Table(name = "ticket_notes")
public class TicketNote {

    @Id
    @UuidGenerator
    @Column(name = "note_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "ticket_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ticketId;

    @Column(name = "content", nullable = false, updatable = false, length = 4000)
    private String content;

    @Column(name = "created_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected TicketNote() {
    }

    public TicketNote(UUID ticketId, String content, UUID createdBy, OffsetDateTime createdAt) {
        this.ticketId = ticketId;
        this.content = content;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTicketId() {
        return ticketId;
    }

    public String getContent() {
        return content;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
