package com.facet.backend.modules.ticket.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.TicketNote;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TicketNoteRepository extends JpaRepository<TicketNote, UUID> {

    List<TicketNote> findByTicketIdOrderByCreatedAtAsc(UUID ticketId);
}
