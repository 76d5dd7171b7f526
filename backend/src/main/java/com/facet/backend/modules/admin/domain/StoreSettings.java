package com.facet.backend.modules.admin.domain;

import java.util.UUID;

import com.facet.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * The single store-wide settings row. Also owns the ticket code counter and the admin PIN hash.
 */
@Entity
@Table(name = "store_settings")
public class StoreSettings extends AbstractTimestampedEntity {

    public static final int DEFAULT_MAX_PHOTOS_PER_TICKET = 10;

    @Id
    @UuidGenerator
    @Column(name = "setting_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "store_name", nullable = false, length = 120)
    private String storeName;

    @Column(name = "store_phone", length = 40)
    private String storePhone;

    @Column(name = "store_address", length = 255)
    private String storeAddress;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "USD";

    @Column(name = "ticket_prefix", nullable = false, length = 8)
    private String ticketPrefix = "T";

    @Column(name = "next_ticket_number", nullable = false)
    private long nextTicketNumber = 1;

    @Column(name = "max_photos_per_ticket", nullable = false)
    private int maxPhotosPerTicket = DEFAULT_MAX_PHOTOS_PER_TICKET;

    @Column(name = "admin_pin_hash", nullable = false, length = 255)
    private String adminPinHash;

    @Column(name = "setup_complete", nullable = false)
    private boolean setupComplete;

    /**
     * Returns the next human-readable ticket code and advances the counter.
     * Callers must hold a write lock on this row.
     */
    public String allocateTicketCode() {
        long number = nextTicketNumber;
        nextTicketNumber = number + 1;
        return ticketPrefix + "-" + String.format("%05d", number);
    }

    public UUID getId() {
        return id;
    }

    public String getStoreName() {
        return storeName;
    }

    public void setStoreName(String storeName) {
        this.storeName = storeName;
    }

    public String getStorePhone() {
        return storePhone;
    }

    public void setStorePhone(String storePhone) {
        this.storePhone = storePhone;
    }

    public String getStoreAddress() {
        return storeAddress;
    }

    public void setStoreAddress(String storeAddress) {
        this.storeAddress = storeAddress;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getTicketPrefix() {
        return ticketPrefix;
    }

    public void setTicketPrefix(String ticketPrefix) {
        this.ticketPrefix = ticketPrefix;
    }

    public long getNextTicketNumber() {
        return nextTicketNumber;
    }

    public int getMaxPhotosPerTicket() {
        return maxPhotosPerTicket;
    }

    public void setMaxPhotosPerTicket(int maxPhotosPerTicket) {
        this.maxPhotosPerTicket = maxPhotosPerTicket;
    }

    public String getAdminPinHash() {
        return adminPinHash;
    }

    public void setAdminPinHash(String adminPinHash) {
        this.adminPinHash = adminPinHash;
    }

    public boolean isSetupComplete() {
        return setupComplete;
    }

    public void setSetupComplete(boolean setupComplete) {
        this.setupComplete = setupComplete;
    }
}
