package com.facet.backend.modules.ticket.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ReassignTicketRequest(@NotNull UUID workedBy) {
}
