package com.facet.backend.modules.location.domain;

import java.util.UUID;

import com.facet.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A shelf, drawer or bench where taken-in items wait. Locations are retired, never deleted,
 * because tickets keep pointing at them.
 */
@Entity
@Table(name = "storage_locations")
public class StorageLocation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "location_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected StorageLocation() {
    }

    public StorageLocation(String name) {
        this.name = name;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void rename(String name) {
        this.name = name;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
