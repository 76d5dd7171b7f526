package com.facet.backend.modules.ticket.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

/**
 * Omitted fields stay unchanged.
 */
public record UpdateTicketRequest(
        @Size(min = 1, max = 120) String customerName,
        @Size(max = 40) String customerPhone,
        @Size(min = 1, max = 60) String itemType,
        @Size(min = 1, max = 500) String itemDescription,
        @Size(max = 1000) String conditionNotes,
        @Size(min = 1, max = 2000) String requestedWork,
        LocalDate promiseDate,
        @DecimalMin("0.00") @Digits(integer = 10, fraction = 2) BigDecimal quoteAmount,
        UUID storageLocationId
) {
}
