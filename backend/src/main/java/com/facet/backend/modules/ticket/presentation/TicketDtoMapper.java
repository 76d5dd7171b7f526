package com.facet.backend.modules.ticket.presentation;

import com.facet.backend.modules.ticket.domain.Ticket;
import com.facet.backend.modules.ticket.domain.TicketFieldHistory;
import com.facet.backend.modules.ticket.domain.TicketNote;
import com.facet.backend.modules.ticket.domain.TicketPhoto;
import com.facet.backend.modules.ticket.domain.TicketStatusHistory;
import com.facet.backend.modules.ticket.presentation.dto.FieldHistoryEntryResponse;
import com.facet.backend.modules.ticket.presentation.dto.NoteResponse;
import com.facet.backend.modules.ticket.presentation.dto.PhotoResponse;
import com.facet.backend.modules.ticket.presentation.dto.StatusHistoryEntryResponse;
import com.facet.backend.modules.ticket.presentation.dto.TicketResponse;

public final class TicketDtoMapper {

    private TicketDtoMapper() {
    }

    public static TicketResponse toResponse(Ticket ticket) {
        return new TicketResponse(
                ticket.getId(),
                ticket.getFriendlyCode(),
                ticket.getCustomerName(),
                ticket.getCustomerPhone(),
                ticket.getItemType(),
                ticket.getItemDescription(),
                ticket.getConditionNotes(),
                ticket.getRequestedWork(),
                ticket.getStatus(),
                ticket.isRush(),
                ticket.getPromiseDate(),
                ticket.getQuoteAmount(),
                ticket.getActualAmount(),
                ticket.getStorageLocationId(),
                ticket.getTakenInBy(),
                ticket.getWorkedBy(),
                ticket.getClosedBy(),
                ticket.getClosedAt(),
                ticket.getLastModifiedBy(),
                ticket.getDeletedAt(),
                ticket.getDeletedBy(),
                ticket.getCreatedAt(),
                ticket.getUpdatedAt()
        );
    }

    public static StatusHistoryEntryResponse toResponse(TicketStatusHistory entry) {
        return new StatusHistoryEntryResponse(entry.getId(), entry.getFromStatus(), entry.getToStatus(),
                entry.getChangedBy(), entry.getChangedAt());
    }

    public static FieldHistoryEntryResponse toResponse(TicketFieldHistory entry) {
        return new FieldHistoryEntryResponse(entry.getId(), entry.getFieldName(), entry.getOldValue(),
                entry.getNewValue(), entry.getChangedBy(), entry.getChangedAt());
    }

    public static NoteResponse toResponse(TicketNote note) {
        return new NoteResponse(note.getId(), note.getContent(), note.getCreatedBy(), note.getCreatedAt());
    }

    public static PhotoResponse toResponse(TicketPhoto photo) {
        return new PhotoResponse(photo.getId(), photo.getTicketId(), photo.getContentType(), photo.getSizeBytes(),
                photo.getUploadedBy(), photo.getUploadedAt());
    }
}
