package com.facet.backend.modules.ticket.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdateRushRequest(@NotNull Boolean rush) {
}
