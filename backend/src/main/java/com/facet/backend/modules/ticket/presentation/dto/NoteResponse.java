package com.facet.backend.modules.ticket.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record NoteResponse(
        UUID noteId,
        String content,
        UUID createdBy,
        OffsetDateTime createdAt
) {
}
