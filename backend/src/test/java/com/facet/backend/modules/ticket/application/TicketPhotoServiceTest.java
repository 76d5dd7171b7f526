package com.facet.backend.modules.ticket.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.global.error.ProblemCode;
import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.admin.application.StoreSettingsService;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.application.SessionStore;
import com.facet.backend.modules.auth.domain.Employee;
import com.facet.backend.modules.auth.domain.EmployeeRole;
import com.facet.backend.modules.ticket.domain.Ticket;
import com.facet.backend.modules.ticket.domain.TicketPhoto;
import com.facet.backend.modules.ticket.infrastructure.persistence.TicketPhotoRepository;
import com.facet.backend.modules.ticket.presentation.dto.PhotoResponse;
import com.facet.backend.support.TestEmployees;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TicketPhotoServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T11:00:00Z");

    @Mock
    private TicketLifecycleService ticketLifecycleService;

    @Mock
    private TicketPhotoRepository photoRepository;

    @Mock
    private StoreSettingsService storeSettingsService;

    @Mock
    private PhotoStorage photoStorage;

    @Mock
    private SessionStore sessionStore;

    @Mock
    private AuditLogService auditLogService;

    private TicketPhotoService service;
    private Employee alice;
    private Ticket ticket;

    @BeforeEach
    void setUp() {
        service = new TicketPhotoService(ticketLifecycleService, photoRepository, storeSettingsService, photoStorage,
                new PhotoProperties(1024, Path.of("unused")), new RequestGate(sessionStore), auditLogService,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        alice = TestEmployees.employee("Alice", EmployeeRole.STAFF);
        ticket = new Ticket("FCT-00007", alice.getId());
        ReflectionTestUtils.setField(ticket, "id", UUID.randomUUID());
    }

    @Test
    void storesDetectedTypeUnderTicketScopedKey() {
        when(ticketLifecycleService.lockActiveTicket(ticket.getId())).thenReturn(ticket);
        when(storeSettingsService.maxPhotosPerTicket()).thenReturn(10);
        when(photoRepository.countByTicketId(ticket.getId())).thenReturn(3L);
        when(photoRepository.save(any(TicketPhoto.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PhotoResponse response = service.uploadPhoto(TestEmployees.principal(alice), ticket.getId(),
                PhotoValidatorTest.PNG_BYTES);

        assertThat(response.contentType()).isEqualTo(PhotoValidator.PNG);
        assertThat(response.sizeBytes()).isEqualTo(PhotoValidatorTest.PNG_BYTES.length);
        assertThat(response.uploadedBy()).isEqualTo(alice.getId());
        verify(photoStorage).store(startsWith(ticket.getId() + "/"),
                eq(PhotoValidatorTest.PNG_BYTES));
    }

    @Test
    void rejectsUploadOverTicketLimit() {
        when(ticketLifecycleService.lockActiveTicket(ticket.getId())).thenReturn(ticket);
        when(storeSettingsService.maxPhotosPerTicket()).thenReturn(10);
        when(photoRepository.countByTicketId(ticket.getId())).thenReturn(10L);

        assertThatThrownBy(() -> service.uploadPhoto(TestEmployees.principal(alice), ticket.getId(),
                PhotoValidatorTest.JPEG_BYTES))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo(ProblemCode.PHOTO_LIMIT);
                });
        verify(photoStorage, never()).store(anyString(), any());
    }

    @Test
    void rejectsUnrecognisedOrOversizedContentBeforeTouchingTheTicket() {
        byte[] oversized = Arrays.copyOf(PhotoValidatorTest.JPEG_BYTES, 2048);

        assertThatThrownBy(() -> service.uploadPhoto(TestEmployees.principal(alice), ticket.getId(),
                "GIF89a".getBytes(StandardCharsets.US_ASCII))).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> service.uploadPhoto(TestEmployees.principal(alice), ticket.getId(), oversized))
                .isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> service.uploadPhoto(TestEmployees.principal(alice), ticket.getId(), new byte[0]))
                .isInstanceOf(ProblemException.class);
        verifyNoInteractions(ticketLifecycleService, photoStorage);
    }

    @Test
    void unrelatedStaffCannotUpload() {
        Employee bob = TestEmployees.employee("Bob", EmployeeRole.STAFF);
        when(ticketLifecycleService.lockActiveTicket(ticket.getId())).thenReturn(ticket);

        assertThatThrownBy(() -> service.uploadPhoto(TestEmployees.principal(bob), ticket.getId(),
                PhotoValidatorTest.JPEG_BYTES))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    void deletingPhotoIsAdminOnlyAndRemovesStoredFile() {
        Employee manager = TestEmployees.employee("Mina", EmployeeRole.ADMIN);
        UUID photoId = UUID.randomUUID();
        TicketPhoto photo = new TicketPhoto(ticket.getId(), ticket.getId() + "/a.jpg", PhotoValidator.JPEG, 10,
                alice.getId(), NOW);
        when(photoRepository.findByIdAndTicketId(photoId, ticket.getId())).thenReturn(Optional.of(photo));

        assertThatThrownBy(() -> service.deletePhoto(TestEmployees.principal(alice), ticket.getId(), photoId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));

        service.deletePhoto(TestEmployees.principal(manager), ticket.getId(), photoId);

        verify(photoRepository).delete(photo);
        verify(photoStorage).delete(ticket.getId() + "/a.jpg");
        verify(auditLogService).record(any());
    }

    @Test
    void photosOfDeletedOrMissingTicketsAreNotFound() {
        UUID photoId = UUID.randomUUID();
        when(ticketLifecycleService.findActiveTicket(ticket.getId()))
                .thenThrow(TicketLifecycleService.ticketNotFound());

        assertThatThrownBy(() -> service.listPhotos(TestEmployees.principal(alice), ticket.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
        assertThatThrownBy(() -> service.loadPhoto(TestEmployees.principal(alice), ticket.getId(), photoId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
        verifyNoInteractions(photoRepository, photoStorage);
    }

    @Test
    void loadsStoredBytesOfActiveTicketPhoto() {
        UUID photoId = UUID.randomUUID();
        TicketPhoto photo = new TicketPhoto(ticket.getId(), ticket.getId() + "/b.png", PhotoValidator.PNG,
                PhotoValidatorTest.PNG_BYTES.length, alice.getId(), NOW);
        when(ticketLifecycleService.findActiveTicket(ticket.getId())).thenReturn(ticket);
        when(photoRepository.findByIdAndTicketId(photoId, ticket.getId())).thenReturn(Optional.of(photo));
        when(photoStorage.load(ticket.getId() + "/b.png")).thenReturn(PhotoValidatorTest.PNG_BYTES);

        PhotoContent content = service.loadPhoto(TestEmployees.principal(alice), ticket.getId(), photoId);

        assertThat(content.contentType()).isEqualTo(PhotoValidator.PNG);
        assertThat(content.content()).isEqualTo(PhotoValidatorTest.PNG_BYTES);
    }
}
