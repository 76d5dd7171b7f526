package com.facet.backend.modules.ticket.presentation.dto;

import com.facet.backend.modules.ticket.domain.TicketStatus;

import jakarta.validation.constraints.NotNull;

public record ChangeStatusRequest(@NotNull TicketStatus status) {
}
