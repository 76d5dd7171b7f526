package com.facet.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "admin_sessions")
public class AdminSession extends AbstractSession {

    protected AdminSession() {
    }

    public AdminSession(String tokenHash, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        super(tokenHash, createdAt, expiresAt);
    }
}
