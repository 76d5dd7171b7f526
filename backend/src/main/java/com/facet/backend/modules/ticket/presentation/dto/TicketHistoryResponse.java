package com.facet.backend.modules.ticket.presentation.dto;

import java.util.List;
import java.util.UUID;

public record TicketHistoryResponse(
        UUID ticketId,
        List<StatusHistoryEntryResponse> statusChanges,
        List<FieldHistoryEntryResponse> fieldChanges,
        List<NoteResponse> notes
) {
}
