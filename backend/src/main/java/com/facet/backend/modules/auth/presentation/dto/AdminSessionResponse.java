package com.facet.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record AdminSessionResponse(
        String sessionToken,
        OffsetDateTime expiresAt
) {
}
