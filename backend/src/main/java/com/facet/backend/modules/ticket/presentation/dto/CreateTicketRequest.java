package com.facet.backend.modules.ticket.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTicketRequest(
        @NotBlank @Size(max = 120) String customerName,
        @Size(max = 40) String customerPhone,
        @NotBlank @Size(max = 60) String itemType,
        @NotBlank @Size(max = 500) String itemDescription,
        @Size(max = 1000) String conditionNotes,
        @NotBlank @Size(max = 2000) String requestedWork,
        boolean rush,
        LocalDate promiseDate,
        @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) BigDecimal quoteAmount,
        UUID storageLocationId
) {
}
