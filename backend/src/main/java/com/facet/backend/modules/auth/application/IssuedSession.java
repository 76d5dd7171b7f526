package com.facet.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.SessionKind;

/**
 * A freshly issued session. {@code token} is the only copy of the plaintext bearer value.
 */
public record IssuedSession(SessionKind kind, UUID sessionId, String token, OffsetDateTime expiresAt) {

    @Override
    public String toString() {
        return "IssuedSession[kind=" + kind + ", sessionId=" + sessionId + ", expiresAt=" + expiresAt + "]";
    }
}
