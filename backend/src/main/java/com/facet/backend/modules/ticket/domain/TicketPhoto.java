package com.facet.backend.modules.ticket.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "ticket_photos")
public class TicketPhoto {

    @Id
    @UuidGenerator
    @Column(name = "photo_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "ticket_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ticketId;

    @Column(name = "storage_key", nullable = false, unique = true, updatable = false, length = 200)
    private String storageKey;

    @Column(name = "content_type", nullable = false, updatable = false, length = 32)
    private String contentType;

    @Column(name = "size_bytes", nullable = false, updatable = false)
    private long sizeBytes;

    @Column(name = "uploaded_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID uploadedBy;

    @Column(name = "uploaded_at", nullable = false, updatable = false)
    private OffsetDateTime uploadedAt;

    protected TicketPhoto() {
    }

    public TicketPhoto(UUID ticketId, String storageKey, String contentType, long sizeBytes, UUID uploadedBy,
                       OffsetDateTime uploadedAt) {
        this.ticketId = ticketId;
        this.storageKey = storageKey;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.uploadedBy = uploadedBy;
        this.uploadedAt = uploadedAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getTicketId() {
        return ticketId;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public String getContentType() {
        return contentType;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public UUID getUploadedBy() {
        return uploadedBy;
    }

    public OffsetDateTime getUploadedAt() {
        return uploadedAt;
    }
}
