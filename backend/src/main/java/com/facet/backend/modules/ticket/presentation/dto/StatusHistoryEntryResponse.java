package com.facet.backend.modules.ticket.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.TicketStatus;

public record StatusHistoryEntryResponse(
        UUID historyId,
        TicketStatus fromStatus,
        TicketStatus toStatus,
        UUID changedBy,
        OffsetDateTime changedAt
) {
}
