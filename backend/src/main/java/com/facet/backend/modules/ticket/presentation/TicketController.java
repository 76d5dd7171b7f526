package com.facet.backend.modules.ticket.presentation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.UUID;

import com.facet.backend.global.security.SecurityUtils;
import com.facet.backend.modules.ticket.application.PhotoContent;
import com.facet.backend.modules.ticket.application.TicketLifecycleService;
import com.facet.backend.modules.ticket.application.TicketPhotoService;
import com.facet.backend.modules.ticket.presentation.dto.AddNoteRequest;
import com.facet.backend.modules.ticket.presentation.dto.ChangeStatusRequest;
import com.facet.backend.modules.ticket.presentation.dto.CloseTicketRequest;
import com.facet.backend.modules.ticket.presentation.dto.CreateTicketRequest;
import com.facet.backend.modules.ticket.presentation.dto.NoteResponse;
import com.facet.backend.modules.ticket.presentation.dto.PhotoResponse;
import com.facet.backend.modules.ticket.presentation.dto.ReassignTicketRequest;
import com.facet.backend.modules.ticket.presentation.dto.StatusChangeResponse;
import com.facet.backend.modules.ticket.presentation.dto.TicketHistoryResponse;
import com.facet.backend.modules.ticket.presentation.dto.TicketResponse;
import com.facet.backend.modules.ticket.presentation.dto.UpdateRushRequest;
import com.facet.backend.modules.ticket.presentation.dto.UpdateTicketRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1/tickets")
public class TicketController {

    private final TicketLifecycleService ticketLifecycleService;
    private final TicketPhotoService ticketPhotoService;

    public TicketController(TicketLifecycleService ticketLifecycleService, TicketPhotoService ticketPhotoService) {
        this.ticketLifecycleService = ticketLifecycleService;
        this.ticketPhotoService = ticketPhotoService;
    }

    @PostMapping
    public ResponseEntity<TicketResponse> createTicket(@Valid @RequestBody CreateTicketRequest request) {
        TicketResponse response = ticketLifecycleService.createTicket(SecurityUtils.getCurrentPrincipal(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{ticketId}")
    public ResponseEntity<TicketResponse> getTicket(@PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketLifecycleService.getTicket(SecurityUtils.getCurrentPrincipal(), ticketId));
    }

    @PutMapping("/{ticketId}")
    public ResponseEntity<TicketResponse> updateTicket(
            @PathVariable UUID ticketId,
            @Valid @RequestBody UpdateTicketRequest request
    ) {
        return ResponseEntity.ok(ticketLifecycleService.updateDetails(SecurityUtils.getCurrentPrincipal(), ticketId, request));
    }

    @Operation(
            summary = "Change ticket status",
            description = """
                    Moves an open ticket between working states, or archives a closed ticket. \
                    Staff may only change tickets they took in or are working on. \
                    Closing uses the close endpoint.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed and history entry appended"),
            @ApiResponse(responseCode = "403", description = "`FORBIDDEN`: missing permission or not an owner"),
            @ApiResponse(responseCode = "409", description = "`CONFLICT`: transition not allowed from the current status")
    })
    @PostMapping("/{ticketId}/status")
    public ResponseEntity<StatusChangeResponse> changeStatus(
            @PathVariable UUID ticketId,
            @Valid @RequestBody ChangeStatusRequest request
    ) {
        return ResponseEntity.ok(ticketLifecycleService.changeStatus(SecurityUtils.getCurrentPrincipal(), ticketId,
                request.status()));
    }

    @Operation(summary = "Close ticket", description = "Admin only. Requires the final `actualAmount`.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ticket closed"),
            @ApiResponse(responseCode = "400", description = "`VALIDATION_ERROR`: actualAmount missing or negative"),
            @ApiResponse(responseCode = "403", description = "`FORBIDDEN`: caller cannot close tickets"),
            @ApiResponse(responseCode = "409", description = "`CONFLICT`: ticket already closed or archived")
    })
    @PostMapping("/{ticketId}/close")
    public ResponseEntity<StatusChangeResponse> closeTicket(
            @PathVariable UUID ticketId,
            @RequestBody CloseTicketRequest request
    ) {
        return ResponseEntity.ok(ticketLifecycleService.closeTicket(SecurityUtils.getCurrentPrincipal(), ticketId,
                request.actualAmount()));
    }

    @PostMapping("/{ticketId}/rush")
    public ResponseEntity<TicketResponse> updateRush(
            @PathVariable UUID ticketId,
            @Valid @RequestBody UpdateRushRequest request
    ) {
        return ResponseEntity.ok(ticketLifecycleService.updateRush(SecurityUtils.getCurrentPrincipal(), ticketId,
                request.rush()));
    }

    @PostMapping("/{ticketId}/reassign")
    public ResponseEntity<TicketResponse> reassign(
            @PathVariable UUID ticketId,
            @Valid @RequestBody ReassignTicketRequest request
    ) {
        return ResponseEntity.ok(ticketLifecycleService.reassign(SecurityUtils.getCurrentPrincipal(), ticketId,
                request.workedBy()));
    }

    @PostMapping("/{ticketId}/notes")
    public ResponseEntity<NoteResponse> addNote(
            @PathVariable UUID ticketId,
            @Valid @RequestBody AddNoteRequest request
    ) {
        NoteResponse response = ticketLifecycleService.addNote(SecurityUtils.getCurrentPrincipal(), ticketId,
                request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{ticketId}/photos")
    public ResponseEntity<List<PhotoResponse>> listPhotos(@PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketPhotoService.listPhotos(SecurityUtils.getCurrentPrincipal(), ticketId));
    }

    @Operation(
            summary = "Upload photo",
            description = "Accepts JPEG, PNG or WebP, detected from the file content rather than the declared type."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Photo stored"),
            @ApiResponse(responseCode = "400", description = "`VALIDATION_ERROR`: empty, too large or unsupported format"),
            @ApiResponse(responseCode = "422", description = "`PHOTO_LIMIT`: ticket already has the maximum number of photos")
    })
    @PostMapping(path = "/{ticketId}/photos", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<PhotoResponse> uploadPhoto(
            @PathVariable UUID ticketId,
            @RequestPart("file") MultipartFile file
    ) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read uploaded photo", ex);
        }
        PhotoResponse response = ticketPhotoService.uploadPhoto(SecurityUtils.getCurrentPrincipal(), ticketId, content);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{ticketId}/photos/{photoId}/content")
    public ResponseEntity<byte[]> downloadPhoto(@PathVariable UUID ticketId, @PathVariable UUID photoId) {
        PhotoContent photo = ticketPhotoService.loadPhoto(SecurityUtils.getCurrentPrincipal(), ticketId, photoId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(photo.contentType()))
                .body(photo.content());
    }

    @DeleteMapping("/{ticketId}/photos/{photoId}")
    public ResponseEntity<Void> deletePhoto(@PathVariable UUID ticketId, @PathVariable UUID photoId) {
        ticketPhotoService.deletePhoto(SecurityUtils.getCurrentPrincipal(), ticketId, photoId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{ticketId}")
    public ResponseEntity<TicketResponse> softDelete(@PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketLifecycleService.softDelete(SecurityUtils.getCurrentPrincipal(), ticketId));
    }

    @PostMapping("/{ticketId}/restore")
    public ResponseEntity<TicketResponse> restore(@PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketLifecycleService.restore(SecurityUtils.getCurrentPrincipal(), ticketId));
    }

    @DeleteMapping("/{ticketId}/purge")
    public ResponseEntity<Void> purge(@PathVariable UUID ticketId) {
        ticketLifecycleService.purge(SecurityUtils.getCurrentPrincipal(), ticketId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{ticketId}/history")
    public ResponseEntity<TicketHistoryResponse> getHistory(@PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketLifecycleService.getHistory(SecurityUtils.getCurrentPrincipal(), ticketId));
    }
}
