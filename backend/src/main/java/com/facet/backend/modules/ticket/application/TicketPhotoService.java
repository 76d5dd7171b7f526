package com.facet.backend.modules.ticket.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.facet.backend.global.error.ProblemCode;
import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.admin.application.StoreSettingsService;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.ticket.domain.Ticket;
import com.facet.backend.modules.ticket.domain.TicketPhoto;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketPhotoRepository;
import com.facet.backend.modules.ticket.presentation.TicketDtoMapper;
import com.facet.backend.modules.ticket.presentation.dto.PhotoResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TicketPhotoService {

    private static final Logger log = LoggerFactory.getLogger(TicketPhotoService.class);

    private final TicketLifecycleService ticketLifecycleService;
    private final TicketPhotoRepository photoRepository;
    private final StoreSettingsService storeSettingsService;
    private final PhotoStorage photoStorage;
    private final PhotoProperties photoProperties;
    private final RequestGate requestGate;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public TicketPhotoService(
            TicketLifecycleService ticketLifecycleService,
            TicketPhotoRepository photoRepository,
            StoreSettingsService storeSettingsService,
            PhotoStorage photoStorage,
            PhotoProperties photoProperties,
            RequestGate requestGate,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.ticketLifecycleService = ticketLifecycleService;
        this.photoRepository = photoRepository;
        this.storeSettingsService = storeSettingsService;
        this.photoStorage = photoStorage;
        this.photoProperties = photoProperties;
        this.requestGate = requestGate;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Validates and stores a photo. The ticket row lock serialises uploads, so the per-ticket
     * limit cannot be overshot by concurrent requests.
     */
    public PhotoResponse uploadPhoto(SessionPrincipal actor, @NonNull UUID ticketId, byte[] content) {
        requestGate.authorize(actor, Permission.UPLOAD_PHOTOS).orThrow();
        UUID actorId = TicketLifecycleService.requireEmployee(actor);

        if (content == null || content.length == 0) {
            throw ProblemException.validation("Photo is empty");
        }
        if (content.length > photoProperties.maxSizeBytes()) {
            throw ProblemException.validation("Photo exceeds " + photoProperties.maxSizeBytes() + " bytes");
        }
        String contentType = PhotoValidator.detectContentType(content)
                .orElseThrow(() -> ProblemException.validation("Only JPEG, PNG and WebP photos are accepted"));

        Ticket ticket = ticketLifecycleService.lockActiveTicket(ticketId);
        requestGate.authorizeOwned(actor, ticket, Permission.UPLOAD_PHOTOS).orThrow();

        int limit = storeSettingsService.maxPhotosPerTicket();
        if (photoRepository.countByTicketId(ticketId) >= limit) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ProblemCode.PHOTO_LIMIT,
                    "Ticket already has the maximum of " + limit + " photos");
        }

        String storageKey = ticketId + "/" + UUID.randomUUID() + "." + PhotoValidator.extensionFor(contentType);
        TicketPhoto photo = photoRepository.save(new TicketPhoto(ticketId, storageKey, contentType, content.length,
                actorId, OffsetDateTime.now(clock)));
        photoStorage.store(storageKey, content);
        log.info("Stored {} byte {} photo for ticket {}", content.length, contentType, ticket.getFriendlyCode());
        return TicketDtoMapper.toResponse(photo);
    }

    @Transactional(readOnly = true)
    public List<PhotoResponse> listPhotos(SessionPrincipal actor, @NonNull UUID ticketId) {
        requestGate.authorize(actor, Permission.VIEW_TICKET).orThrow();
        ticketLifecycleService.findActiveTicket(ticketId);
        return photoRepository.findByTicketIdOrderByUploadedAtAsc(ticketId).stream()
                .map(TicketDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public PhotoContent loadPhoto(SessionPrincipal actor, @NonNull UUID ticketId, @NonNull UUID photoId) {
        requestGate.authorize(actor, Permission.VIEW_TICKET).orThrow();
        ticketLifecycleService.findActiveTicket(ticketId);
        TicketPhoto photo = photoRepository.findByIdAndTicketId(photoId, ticketId)
                .orElseThrow(() -> ProblemException.notFound("Photo not found"));
        return new PhotoContent(photo.getContentType(), photoStorage.load(photo.getStorageKey()));
    }

    public void deletePhoto(SessionPrincipal actor, @NonNull UUID ticketId, @NonNull UUID photoId) {
        requestGate.authorize(actor, Permission.DELETE_PHOTOS).orThrow();
        TicketLifecycleService.requireEmployee(actor);
        ticketLifecycleService.lockActiveTicket(ticketId);

        TicketPhoto photo = photoRepository.findByIdAndTicketId(photoId, ticketId)
                .orElseThrow(() -> ProblemException.notFound("Photo not found"));
        photoRepository.delete(photo);
        auditLogService.record(new AuditLogCommand("TICKET_PHOTO_DELETED", "TICKET", ticketId.toString(),
                actor, Map.of("photoId", photoId.toString())));
        photoStorage.delete(photo.getStorageKey());
    }
}
