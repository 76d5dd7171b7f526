package com.facet.backend.modules.ticket.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record FieldHistoryEntryResponse(
        UUID historyId,
        String fieldName,
        String oldValue,
        String newValue,
        UUID changedBy,
        OffsetDateTime changedAt
) {
}
