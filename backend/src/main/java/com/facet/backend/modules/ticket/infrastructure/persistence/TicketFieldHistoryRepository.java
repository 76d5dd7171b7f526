package com.facet.backend.modules.ticket.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.TicketFieldHistory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TicketFieldHistoryRepository extends JpaRepository<TicketFieldHistory, UUID> {

    List<TicketFieldHistory> findByTicketIdOrderByChangedAtAsc(UUID ticketId);

    long countByTicketId(UUID ticketId);
}
