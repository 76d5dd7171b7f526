package com.facet.backend.modules.ticket.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.TicketStatusHistory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TicketStatusHistoryRepository extends JpaRepository<TicketStatusHistory, UUID> {

    List<TicketStatusHistory> findByTicketIdOrderByChangedAtAsc(UUID ticketId);

    long countByTicketId(UUID ticketId);
}
