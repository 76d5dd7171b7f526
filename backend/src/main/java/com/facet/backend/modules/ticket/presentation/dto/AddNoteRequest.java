package com.facet.backend.modules.ticket.presentation.dto;

import jakarta.validation.constraints.Size;

public record AddNoteRequest(@Size(max = 4000) String content) {
}
