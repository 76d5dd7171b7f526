package com.facet.backend.modules.ticket.presentation.dto;

public record StatusChangeResponse(
        TicketResponse ticket,
        StatusHistoryEntryResponse historyEntry
) {
}
