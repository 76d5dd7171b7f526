package com.facet.backend.modules.ticket.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.TicketPhoto;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TicketPhotoRepository extends JpaRepository<TicketPhoto, UUID> {

    long countByTicketId(UUID ticketId);

    Optional<TicketPhoto> findByIdAndTicketId(UUID id, UUID ticketId);

    List<TicketPhoto> findByTicketIdOrderByUploadedAtAsc(UUID ticketId);
}
