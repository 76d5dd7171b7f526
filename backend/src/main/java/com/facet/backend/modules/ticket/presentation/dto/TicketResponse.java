package com.facet.backend.modules.ticket.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.TicketStatus;

public record TicketResponse(
        UUID ticketId,
        String friendlyCode,
        String customerName,
        String customerPhone,
        String itemType,
        String itemDescription,
        String conditionNotes,
        String requestedWork,
        TicketStatus status,
        boolean rush,
        LocalDate promiseDate,
        BigDecimal quoteAmount,
        BigDecimal actualAmount,
        UUID storageLocationId,
        UUID takenInBy,
        UUID workedBy,
        UUID closedBy,
        OffsetDateTime closedAt,
        UUID lastModifiedBy,
        OffsetDateTime deletedAt,
        UUID deletedBy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
