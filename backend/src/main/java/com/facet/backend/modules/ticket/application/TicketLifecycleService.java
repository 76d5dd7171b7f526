package com.facet.backend.modules.ticket.application;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.admin.application.StoreSettingsService;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.auth.infrastructure.persistence.EmployeeRepository;
import com.facet.backend.modules.location.application.StorageLocationService;
import com.facet.backend.modules.ticket.domain.Ticket;
import com.facet.backend.modules.ticket.domain.TicketFieldHistory;
import com.facet.backend.modules.ticket.domain.TicketNote;
import com.facet.backend.modules.ticket.domain.TicketPhoto;
import com.facet.backend.modules.ticket.domain.TicketStatus;
import com.facet.backend.modules.ticket.domain.TicketStatusHistory;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketFieldHistoryRepository;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketNoteRepository;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketPhotoRepository;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketRepository;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketStatusHistoryRepository;
import com.facet.backend.modules.ticket.presentation.TicketDtoMapper;
import com.facet.backend.modules.ticket.presentation.dto.CreateTicketRequest;
import com.facet.backend.modules.ticket.presentation.dto.NoteResponse;
import com.facet.backend.modules.ticket.presentation.dto.StatusChangeResponse;
import com.facet.backend.modules.ticket.presentation.dto.TicketHistoryResponse;
import com.facet.backend.modules.ticket.presentation.dto.TicketResponse;
import com.facet.backend.modules.ticket.presentation.dto.UpdateTicketRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every mutation locks the ticket row and appends its history entry in the same transaction,
 * so a status change and its history row are never observed apart.
 */
@Service
@Transactional
public class TicketLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TicketLifecycleService.class);
    private static final String RESOURCE_TYPE = "TICKET";

    private final TicketRepository ticketRepository;
    private final TicketStatusHistoryRepository statusHistoryRepository;
    private final TicketFieldHistoryRepository fieldHistoryRepository;
    private final TicketNoteRepository noteRepository;
    private final TicketPhotoRepository photoRepository;
    private final EmployeeRepository employeeRepository;
    private final StoreSettingsService storeSettingsService;
    private final StorageLocationService storageLocationService;
    private final PhotoStorage photoStorage;
    private final RequestGate requestGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public TicketLifecycleService(
            TicketRepository ticketRepository,
            TicketStatusHistoryRepository statusHistoryRepository,
            TicketFieldHistoryRepository fieldHistoryRepository,
            TicketNoteRepository noteRepository,
            TicketPhotoRepository photoRepository,
            EmployeeRepository employeeRepository,
            StoreSettingsService storeSettingsService,
            StorageLocationService storageLocationService,
            PhotoStorage photoStorage,
            RequestGate requestGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.ticketRepository = ticketRepository;
        this.statusHistoryRepository = statusHistoryRepository;
        this.fieldHistoryRepository = fieldHistoryRepository;
        this.noteRepository = noteRepository;
        this.photoRepository = photoRepository;
        this.employeeRepository = employeeRepository;
        this.storeSettingsService = storeSettingsService;
        this.storageLocationService = storageLocationService;
        this.photoStorage = photoStorage;
        this.requestGate = requestGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public TicketResponse createTicket(SessionPrincipal actor, @NonNull CreateTicketRequest request) {
        requestGate.authorize(actor, Permission.CREATE_TICKET).orThrow();
        UUID actorId = requireEmployee(actor);
        OffsetDateTime now = OffsetDateTime.now(clock);
        UUID locationId = request.storageLocationId() == null
                ? null
                : storageLocationService.requireActiveLocation(request.storageLocationId()).getId();

        Ticket ticket = new Ticket(storeSettingsService.allocateTicketCode(), actorId);
        ticket.setCustomerName(request.customerName().strip());
        ticket.setCustomerPhone(request.customerPhone());
        ticket.setItemType(request.itemType().strip());
        ticket.setItemDescription(request.itemDescription().strip());
        ticket.setConditionNotes(request.conditionNotes());
        ticket.setRequestedWork(request.requestedWork().strip());
        ticket.setRush(request.rush());
        ticket.setPromiseDate(request.promiseDate());
        ticket.setQuoteAmount(request.quoteAmount());
        ticket.setStorageLocationId(locationId);
        ticketRepository.save(ticket);

        statusHistoryRepository.save(new TicketStatusHistory(ticket.getId(), null, TicketStatus.INTAKE, actorId, now));
        log.info("Ticket {} taken in by employee {}", ticket.getFriendlyCode(), actorId);
        return TicketDtoMapper.toResponse(ticket);
    }

    @Transactional(readOnly = true)
    public TicketResponse getTicket(SessionPrincipal actor, @NonNull UUID ticketId) {
        requestGate.authorize(actor, Permission.VIEW_TICKET).orThrow();
        return TicketDtoMapper.toResponse(findActiveTicket(ticketId));
    }

    /**
     * Moves an open ticket between working states, or archives a closed one.
     * Closing goes through {@link #closeTicket} instead.
     */
    public StatusChangeResponse changeStatus(SessionPrincipal actor, @NonNull UUID ticketId, @NonNull TicketStatus target) {
        requestGate.authorize(actor, Permission.MODIFY_OWN_TICKET).orThrow();
        UUID actorId = requireEmployee(actor);
        if (target == TicketStatus.CLOSED) {
            throw ProblemException.conflict("Tickets are closed through the close operation");
        }

        Ticket ticket = lockActiveTicket(ticketId);
        requestGate.authorizeOwned(actor, ticket, Permission.MODIFY_OWN_TICKET).orThrow();
        if (target == TicketStatus.ARCHIVED) {
            requestGate.authorize(actor, Permission.ARCHIVE_TICKETS).orThrow();
        }

        TicketStatus from = ticket.getStatus();
        if (!from.canTransitionTo(target)) {
            throw ProblemException.conflict("Cannot move a ticket from " + from + " to " + target);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ticket.setStatus(target);
        ticket.setLastModifiedBy(actorId);
        TicketStatusHistory entry = statusHistoryRepository.save(
                new TicketStatusHistory(ticket.getId(), from, target, actorId, now));
        return new StatusChangeResponse(TicketDtoMapper.toResponse(ticket), TicketDtoMapper.toResponse(entry));
    }

    public StatusChangeResponse closeTicket(SessionPrincipal actor, @NonNull UUID ticketId, BigDecimal actualAmount) {
        requestGate.authorize(actor, Permission.CLOSE_ANY_TICKET).orThrow();
        UUID actorId = requireEmployee(actor);
        if (actualAmount == null) {
            throw ProblemException.validation("actualAmount is required to close a ticket");
        }
        if (actualAmount.signum() < 0) {
            throw ProblemException.validation("actualAmount must not be negative");
        }

        Ticket ticket = lockActiveTicket(ticketId);
        TicketStatus from = ticket.getStatus();
        if (!from.canClose()) {
            throw ProblemException.conflict("Ticket is already " + from);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ticket.close(actualAmount, actorId, now);
        TicketStatusHistory entry = statusHistoryRepository.save(
                new TicketStatusHistory(ticket.getId(), from, TicketStatus.CLOSED, actorId, now));
        log.info("Ticket {} closed by employee {}", ticket.getFriendlyCode(), actorId);
        return new StatusChangeResponse(TicketDtoMapper.toResponse(ticket), TicketDtoMapper.toResponse(entry));
    }

    public TicketResponse updateRush(SessionPrincipal actor, @NonNull UUID ticketId, boolean rush) {
        requestGate.authorize(actor, Permission.MODIFY_OWN_TICKET).orThrow();
        UUID actorId = requireEmployee(actor);
        Ticket ticket = lockActiveTicket(ticketId);
        requestGate.authorizeOwned(actor, ticket, Permission.MODIFY_OWN_TICKET).orThrow();
        ensureEditable(ticket);

        if (ticket.isRush() != rush) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            fieldHistoryRepository.save(new TicketFieldHistory(ticket.getId(), "is_rush",
                    Boolean.toString(ticket.isRush()), Boolean.toString(rush), actorId, now));
            ticket.setRush(rush);
            ticket.setLastModifiedBy(actorId);
        }
        return TicketDtoMapper.toResponse(ticket);
    }

    public TicketResponse updateDetails(SessionPrincipal actor, @NonNull UUID ticketId, @NonNull UpdateTicketRequest request) {
        requestGate.authorize(actor, Permission.MODIFY_OWN_TICKET).orThrow();
        UUID actorId = requireEmployee(actor);
        Ticket ticket = lockActiveTicket(ticketId);
        requestGate.authorizeOwned(actor, ticket, Permission.MODIFY_OWN_TICKET).orThrow();
        ensureEditable(ticket);

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<TicketFieldHistory> changes = new ArrayList<>();

        if (request.customerName() != null) {
            String value = requireText(request.customerName(), "customerName");
            track(changes, ticket, "customer_name", ticket.getCustomerName(), value, actorId, now);
            ticket.setCustomerName(value);
        }
        if (request.customerPhone() != null) {
            track(changes, ticket, "customer_phone", ticket.getCustomerPhone(), request.customerPhone(), actorId, now);
            ticket.setCustomerPhone(request.customerPhone());
        }
        if (request.itemType() != null) {
            String value = requireText(request.itemType(), "itemType");
            track(changes, ticket, "item_type", ticket.getItemType(), value, actorId, now);
            ticket.setItemType(value);
        }
        if (request.itemDescription() != null) {
            String value = requireText(request.itemDescription(), "itemDescription");
            track(changes, ticket, "item_description", ticket.getItemDescription(), value, actorId, now);
            ticket.setItemDescription(value);
        }
        if (request.conditionNotes() != null) {
            track(changes, ticket, "condition_notes", ticket.getConditionNotes(), request.conditionNotes(), actorId, now);
            ticket.setConditionNotes(request.conditionNotes());
        }
        if (request.requestedWork() != null) {
            String value = requireText(request.requestedWork(), "requestedWork");
            track(changes, ticket, "requested_work", ticket.getRequestedWork(), value, actorId, now);
            ticket.setRequestedWork(value);
        }
        if (request.promiseDate() != null) {
            track(changes, ticket, "promise_date", asText(ticket.getPromiseDate()), asText(request.promiseDate()),
                    actorId, now);
            ticket.setPromiseDate(request.promiseDate());
        }
        if (request.quoteAmount() != null) {
            if (request.quoteAmount().signum() < 0) {
                throw ProblemException.validation("quoteAmount must not be negative");
            }
            track(changes, ticket, "quote_amount", asText(ticket.getQuoteAmount()), asText(request.quoteAmount()),
                    actorId, now);
            ticket.setQuoteAmount(request.quoteAmount());
        }
        if (request.storageLocationId() != null
                && !request.storageLocationId().equals(ticket.getStorageLocationId())) {
            UUID locationId = storageLocationService.requireActiveLocation(request.storageLocationId()).getId();
            track(changes, ticket, "storage_location_id", asText(ticket.getStorageLocationId()), asText(locationId),
                    actorId, now);
            ticket.setStorageLocationId(locationId);
        }

        if (!changes.isEmpty()) {
            fieldHistoryRepository.saveAll(changes);
            ticket.setLastModifiedBy(actorId);
        }
        return TicketDtoMapper.toResponse(ticket);
    }

    /**
     * Changes who works the ticket. {@code taken_in_by} never changes.
     */
    public TicketResponse reassign(SessionPrincipal actor, @NonNull UUID ticketId, @NonNull UUID workedBy) {
        requestGate.authorize(actor, Permission.REASSIGN_TICKETS).orThrow();
        UUID actorId = requireEmployee(actor);
        Ticket ticket = lockActiveTicket(ticketId);
        ensureEditable(ticket);
        employeeRepository.findByIdAndActiveTrue(workedBy)
                .orElseThrow(() -> ProblemException.validation("workedBy must reference an active employee"));

        if (!workedBy.equals(ticket.getWorkedBy())) {
            OffsetDateTime now = OffsetDateTime.now(clock);
            fieldHistoryRepository.save(new TicketFieldHistory(ticket.getId(), "worked_by",
                    asText(ticket.getWorkedBy()), workedBy.toString(), actorId, now));
            ticket.setWorkedBy(workedBy);
            ticket.setLastModifiedBy(actorId);
        }
        return TicketDtoMapper.toResponse(ticket);
    }

    public NoteResponse addNote(SessionPrincipal actor, @NonNull UUID ticketId, String content) {
        requestGate.authorize(actor, Permission.ADD_NOTES).orThrow();
        UUID actorId = requireEmployee(actor);
        if (content == null || content.isBlank()) {
            throw ProblemException.validation("Note content must not be empty");
        }
        Ticket ticket = lockActiveTicket(ticketId);
        requestGate.authorizeOwned(actor, ticket, Permission.ADD_NOTES).orThrow();

        TicketNote note = noteRepository.save(new TicketNote(ticket.getId(), content.strip(), actorId,
                OffsetDateTime.now(clock)));
        return TicketDtoMapper.toResponse(note);
    }

    public TicketResponse softDelete(SessionPrincipal actor, @NonNull UUID ticketId) {
        requestGate.authorize(actor, Permission.DELETE_TICKETS).orThrow();
        UUID actorId = requireEmployee(actor);
        Ticket ticket = lockActiveTicket(ticketId);
        if (ticket.getStatus() == TicketStatus.ARCHIVED) {
            throw ProblemException.conflict("Archived tickets cannot be deleted");
        }

        ticket.markDeleted(actorId, OffsetDateTime.now(clock));
        auditLogService.record(new AuditLogCommand("TICKET_SOFT_DELETED", RESOURCE_TYPE, ticket.getId().toString(),
                actor, Map.of("friendlyCode", ticket.getFriendlyCode())));
        return TicketDtoMapper.toResponse(ticket);
    }

    public TicketResponse restore(SessionPrincipal actor, @NonNull UUID ticketId) {
        requestGate.authorize(actor, Permission.DELETE_TICKETS).orThrow();
        requireEmployee(actor);
        Ticket ticket = ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(TicketLifecycleService::ticketNotFound);
        if (!ticket.isDeleted()) {
            throw ProblemException.conflict("Ticket is not deleted");
        }

        ticket.restore();
        auditLogService.record(new AuditLogCommand("TICKET_RESTORED", RESOURCE_TYPE, ticket.getId().toString(),
                actor, Map.of("friendlyCode", ticket.getFriendlyCode())));
        return TicketDtoMapper.toResponse(ticket);
    }

    /**
     * Permanently removes a ticket that has never accumulated history. Any history row blocks the purge.
     */
    public void purge(SessionPrincipal actor, @NonNull UUID ticketId) {
        requestGate.authorize(actor, Permission.DELETE_TICKETS).orThrow();
        requireEmployee(actor);
        Ticket ticket = ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(TicketLifecycleService::ticketNotFound);

        long historyRows = statusHistoryRepository.countByTicketId(ticketId) + fieldHistoryRepository.countByTicketId(ticketId);
        if (historyRows > 0) {
            throw ProblemException.conflict("Ticket has history and cannot be permanently deleted");
        }

        List<String> storageKeys = photoRepository.findByTicketIdOrderByUploadedAtAsc(ticketId).stream()
                .map(TicketPhoto::getStorageKey)
                .toList();
        try {
            ticketRepository.delete(ticket);
            ticketRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            throw ProblemException.conflict("Ticket is still referenced and cannot be permanently deleted");
        }
        auditLogService.record(new AuditLogCommand("TICKET_PURGED", RESOURCE_TYPE, ticketId.toString(),
                actor, Map.of("friendlyCode", ticket.getFriendlyCode())));
        storageKeys.forEach(photoStorage::delete);
    }

    /**
     * History stays readable after a soft delete; only holders of {@code DELETE_TICKETS} can see it then.
     */
    @Transactional(readOnly = true)
    public TicketHistoryResponse getHistory(SessionPrincipal actor, @NonNull UUID ticketId) {
        requestGate.authorize(actor, Permission.VIEW_TICKET).orThrow();
        Ticket ticket = ticketRepository.findById(ticketId)
                .orElseThrow(TicketLifecycleService::ticketNotFound);
        if (ticket.isDeleted() && !actor.has(Permission.DELETE_TICKETS)) {
            throw ticketNotFound();
        }

        return new TicketHistoryResponse(
                ticket.getId(),
                statusHistoryRepository.findByTicketIdOrderByChangedAtAsc(ticketId).stream()
                        .map(TicketDtoMapper::toResponse)
                        .toList(),
                fieldHistoryRepository.findByTicketIdOrderByChangedAtAsc(ticketId).stream()
                        .map(TicketDtoMapper::toResponse)
                        .toList(),
                noteRepository.findByTicketIdOrderByCreatedAtAsc(ticketId).stream()
                        .map(TicketDtoMapper::toResponse)
                        .toList()
        );
    }

    /**
     * Loads a ticket that has not been soft-deleted, without locking it.
     */
    @Transactional(readOnly = true)
    public Ticket findActiveTicket(UUID ticketId) {
        return ticketRepository.findActiveById(ticketId)
                .orElseThrow(TicketLifecycleService::ticketNotFound);
    }

    /**
     * Loads and write-locks a ticket that has not been soft-deleted.
     */
    public Ticket lockActiveTicket(UUID ticketId) {
        Ticket ticket = ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(TicketLifecycleService::ticketNotFound);
        if (ticket.isDeleted()) {
            throw ticketNotFound();
        }
        return ticket;
    }

    static UUID requireEmployee(SessionPrincipal actor) {
        if (actor.employeeId() == null) {
            throw ProblemException.unauthorized("Ticket operations require an employee session");
        }
        return actor.employeeId();
    }

    static ProblemException ticketNotFound() {
        return ProblemException.notFound("Ticket not found");
    }

    private static void ensureEditable(Ticket ticket) {
        if (!ticket.getStatus().isOpen()) {
            throw ProblemException.conflict("Ticket is " + ticket.getStatus() + " and can no longer be edited");
        }
    }

    private static String requireText(String value, String field) {
        if (value.isBlank()) {
            throw ProblemException.validation(field + " must not be blank");
        }
        return value.strip();
    }

    private static void track(List<TicketFieldHistory> changes, Ticket ticket, String field, String oldValue,
                              String newValue, UUID actorId, OffsetDateTime now) {
        if (!Objects.equals(oldValue, newValue)) {
            changes.add(new TicketFieldHistory(ticket.getId(), field, oldValue, newValue, actorId, now));
        }
    }

    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal amount) {
            return amount.toPlainString();
        }
        return value.toString();
    }
}
