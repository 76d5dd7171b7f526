package com.facet.backend.modules.ticket.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.facet.backend.global.jpa.AbstractTimestampedEntity;
import com.facet.backend.modules.auth.domain.OwnedResource;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "tickets")
public class Ticket extends AbstractTimestampedEntity implements OwnedResource {

    @Id
    @UuidGenerator
    @Column(name = "ticket_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "friendly_code", nullable = false, unique = true, updatable = false, length = 32)
    private String friendlyCode;

    @Column(name = "customer_name", nullable = false, length = 120)
    private String customerName;

    @Column(name = "customer_phone", length = 40)
    private String customerPhone;

    @Column(name = "item_type", nullable = false, length = 60)
    private String itemType;

    @Column(name = "item_description", nullable = false, length = 500)
    private String itemDescription;

    @Column(name = "condition_notes", length = 1000)
    private String conditionNotes;

    @Column(name = "requested_work", nullable = false, length = 2000)
    private String requestedWork;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private TicketStatus status = TicketStatus.INTAKE;

    @Column(name = "is_rush", nullable = false)
    private boolean rush;

    @Column(name = "promise_date")
    private LocalDate promiseDate;

    @Column(name = "quote_amount", precision = 12, scale = 2)
    private BigDecimal quoteAmount;

    @Column(name = "actual_amount", precision = 12, scale = 2)
    private BigDecimal actualAmount;

    @Column(name = "storage_location_id", columnDefinition = "uuid")
    private UUID storageLocationId;

    @Column(name = "taken_in_by", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID takenInBy;

    @Column(name = "worked_by", columnDefinition = "uuid")
    private UUID workedBy;

    @Column(name = "closed_by", columnDefinition = "uuid")
    private UUID closedBy;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Column(name = "last_modified_by", columnDefinition = "uuid")
    private UUID lastModifiedBy;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Column(name = "deleted_by", columnDefinition = "uuid")
    private UUID deletedBy;

    protected Ticket() {
    }

    public Ticket(String friendlyCode, UUID takenInBy) {
        this.friendlyCode = friendlyCode;
        this.takenInBy = takenInBy;
        this.lastModifiedBy = takenInBy;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * Both soft-delete markers are always set or cleared together.
     */
    public void markDeleted(UUID actorId, OffsetDateTime at) {
        this.deletedAt = at;
        this.deletedBy = actorId;
    }

    public void restore() {
        this.deletedAt = null;
        this.deletedBy = null;
    }

    public void close(BigDecimal amount, UUID actorId, OffsetDateTime at) {
        this.status = TicketStatus.CLOSED;
        this.actualAmount = amount;
        this.closedBy = actorId;
        this.closedAt = at;
        this.lastModifiedBy = actorId;
    }

    public UUID getId() {
        return id;
    }

    public String getFriendlyCode() {
        return friendlyCode;
    }

    public String getCustomerName() {
        return customerName;
    }

    public void setCustomerName(String customerName) {
        this.customerName = customerName;
    }

    public String getCustomerPhone() {
        return customerPhone;
    }

    public void setCustomerPhone(String customerPhone) {
        this.customerPhone = customerPhone;
    }

    public String getItemType() {
        return itemType;
    }

    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    public String getItemDescription() {
        return itemDescription;
    }

    public void setItemDescription(String itemDescription) {
        this.itemDescription = itemDescription;
    }

    public String getConditionNotes() {
        return conditionNotes;
    }

    public void setConditionNotes(String conditionNotes) {
        this.conditionNotes = conditionNotes;
    }

    public String getRequestedWork() {
        return requestedWork;
    }

    public void setRequestedWork(String requestedWork) {
        this.requestedWork = requestedWork;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public void setStatus(TicketStatus status) {
        this.status = status;
    }

    public boolean isRush() {
        return rush;
    }

    public void setRush(boolean rush) {
        this.rush = rush;
    }

    public LocalDate getPromiseDate() {
        return promiseDate;
    }

    public void setPromiseDate(LocalDate promiseDate) {
        this.promiseDate = promiseDate;
    }

    public BigDecimal getQuoteAmount() {
        return quoteAmount;
    }

    public void setQuoteAmount(BigDecimal quoteAmount) {
        this.quoteAmount = quoteAmount;
    }

    public UUID getStorageLocationId() {
        return storageLocationId;
    }

    public void setStorageLocationId(UUID storageLocationId) {
        this.storageLocationId = storageLocationId;
    }

    public BigDecimal getActualAmount() {
        return actualAmount;
    }

    @Override
    public UUID getTakenInBy() {
        return takenInBy;
    }

    @Override
    public UUID getWorkedBy() {
        return workedBy;
    }

    public void setWorkedBy(UUID workedBy) {
        this.workedBy = workedBy;
    }

    public UUID getClosedBy() {
        return closedBy;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }

    public UUID getLastModifiedBy() {
        return lastModifiedBy;
    }

    public void setLastModifiedBy(UUID lastModifiedBy) {
        this.lastModifiedBy = lastModifiedBy;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public UUID getDeletedBy() {
        return deletedBy;
    }
}
