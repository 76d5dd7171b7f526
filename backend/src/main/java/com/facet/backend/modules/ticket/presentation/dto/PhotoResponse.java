package com.facet.backend.modules.ticket.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record PhotoResponse(
        UUID photoId,
        UUID ticketId,
        String contentType,
        long sizeBytes,
        UUID uploadedBy,
        OffsetDateTime uploadedAt
) {
}
