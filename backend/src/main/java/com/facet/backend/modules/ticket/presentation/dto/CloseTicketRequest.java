package com.facet.backend.modules.ticket.presentation.dto;

import java.math.BigDecimal;

/**
 * {@code actualAmount} is checked by the service so a missing amount reports the same way from every caller.
 */
public record CloseTicketRequest(BigDecimal actualAmount) {
}
