package com.facet.backend.modules.ticket.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a repair ticket. {@link #CLOSED} is reached only through the dedicated close
 * operation, which is allowed from any open status.
 */
public enum TicketStatus {
    INTAKE,
    IN_PROGRESS,
    WAITING_ON_PARTS,
    READY_FOR_PICKUP,
    CLOSED,
    ARCHIVED;

    public boolean isOpen() {
        return this != CLOSED && this != ARCHIVED;
    }

    /**
     * Targets reachable through a plain status change. Same-status moves are never listed.
     */
    public Set<TicketStatus> allowedTargets() {
        return switch (this) {
            case INTAKE -> EnumSet.of(IN_PROGRESS, WAITING_ON_PARTS, READY_FOR_PICKUP);
            case IN_PROGRESS -> EnumSet.of(WAITING_ON_PARTS, READY_FOR_PICKUP);
            case WAITING_ON_PARTS -> EnumSet.of(IN_PROGRESS, READY_FOR_PICKUP);
            case READY_FOR_PICKUP -> EnumSet.of(IN_PROGRESS, WAITING_ON_PARTS);
            case CLOSED -> EnumSet.of(ARCHIVED);
            case ARCHIVED -> EnumSet.noneOf(TicketStatus.class);
        };
    }

    public boolean canTransitionTo(TicketStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean canClose() {
        return isOpen();
    }
}
