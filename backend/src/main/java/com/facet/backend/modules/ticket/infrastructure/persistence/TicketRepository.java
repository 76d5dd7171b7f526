package com.facet.backend.modules.ticket.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.ticket.domain.Ticket;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TicketRepository extends JpaRepository<Ticket, UUID> {

    @Query("select t from Ticket t where t.id = :id and t.deletedAt is null")
    Optional<Ticket> findActiveById(@Param("id") UUID id);

    /**
     * Includes soft-deleted rows; callers decide whether a deleted ticket is addressable.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Ticket t where t.id = :id")
    Optional<Ticket> findByIdForUpdate(@Param("id") UUID id);
}
