package com.facet.backend.modules.location.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.global.error.ProblemCode;
import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.application.SessionStore;
import com.facet.backend.modules.auth.domain.EmployeeRole;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.location.domain.StorageLocation;
import com.facet.backend.modules.location.infrastructure.persistence.StorageLocationRepository;
import com.facet.backend.modules.location.presentation.dto.CreateLocationRequest;
import com.facet.backend.modules.location.presentation.dto.LocationResponse;
import com.facet.backend.modules.location.presentation.dto.UpdateLocationRequest;
import com.facet.backend.support.TestEmployees;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class StorageLocationServiceTest {

    @Mock
    private StorageLocationRepository locationRepository;

    @Mock
    private SessionStore sessionStore;

    @Mock
    private AuditLogService auditLogService;

    private StorageLocationService service;
    private SessionPrincipal adminSession;
    private SessionPrincipal staffSession;

    @BeforeEach
    void setUp() {
        service = new StorageLocationService(locationRepository, new RequestGate(sessionStore), auditLogService);
        adminSession = TestEmployees.adminSession();
        staffSession = TestEmployees.principal(TestEmployees.employee("Alice", EmployeeRole.STAFF));
    }

    @Test
    void staffSeeOnlyActiveLocations() {
        StorageLocation drawer = location("Safe Drawer 1", true);
        when(locationRepository.findByActiveTrueOrderByNameAsc()).thenReturn(List.of(drawer));

        List<LocationResponse> locations = service.listLocations(staffSession, false);

        assertThat(locations).extracting(LocationResponse::name).containsExactly("Safe Drawer 1");
        verify(locationRepository, never()).findAllByOrderByNameAsc();
    }

    @Test
    void retiredLocationsNeedLocationManagement() {
        assertThatThrownBy(() -> service.listLocations(staffSession, true))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.FORBIDDEN));
        verifyNoInteractions(locationRepository);
    }

    @Test
    void staffCannotCreateLocations() {
        assertThatThrownBy(() -> service.createLocation(staffSession, new CreateLocationRequest("Workbench A")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
        verifyNoInteractions(locationRepository, auditLogService);
    }

    @Test
    void createTrimsNameAndAudits() {
        when(locationRepository.findByNameIgnoreCase("Workbench A")).thenReturn(Optional.empty());
        when(locationRepository.saveAndFlush(any(StorageLocation.class))).thenAnswer(invocation -> {
            StorageLocation saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });

        LocationResponse response = service.createLocation(adminSession, new CreateLocationRequest("  Workbench A "));

        assertThat(response.name()).isEqualTo("Workbench A");
        assertThat(response.active()).isTrue();
        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().actionType()).isEqualTo("LOCATION_CREATED");
    }

    @Test
    void namesAreUniqueIgnoringCase() {
        when(locationRepository.findByNameIgnoreCase("workbench a"))
                .thenReturn(Optional.of(location("Workbench A", true)));

        assertThatThrownBy(() -> service.createLocation(adminSession, new CreateLocationRequest("workbench a")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.CONFLICT));
        verify(locationRepository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentDuplicateIsStillAConflict() {
        when(locationRepository.findByNameIgnoreCase("Workbench A")).thenReturn(Optional.empty());
        when(locationRepository.saveAndFlush(any(StorageLocation.class)))
                .thenThrow(new DataIntegrityViolationException("ux_storage_locations_name"));

        assertThatThrownBy(() -> service.createLocation(adminSession, new CreateLocationRequest("Workbench A")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.CONFLICT));
        verifyNoInteractions(auditLogService);
    }

    @Test
    void retiringLocationIsAudited() {
        StorageLocation drawer = location("Safe Drawer 1", true);
        when(locationRepository.findById(drawer.getId())).thenReturn(Optional.of(drawer));

        LocationResponse response = service.updateLocation(adminSession, drawer.getId(),
                new UpdateLocationRequest(null, false));

        assertThat(response.active()).isFalse();
        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().detail()).containsEntry("active", false);
    }

    @Test
    void renamingOntoAnotherLocationIsAConflict() {
        StorageLocation drawer = location("Safe Drawer 1", true);
        when(locationRepository.findById(drawer.getId())).thenReturn(Optional.of(drawer));
        when(locationRepository.findByNameIgnoreCase("Display Case"))
                .thenReturn(Optional.of(location("Display Case", true)));

        assertThatThrownBy(() -> service.updateLocation(adminSession, drawer.getId(),
                new UpdateLocationRequest("Display Case", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.CONFLICT));
        assertThat(drawer.getName()).isEqualTo("Safe Drawer 1");
    }

    @Test
    void unchangedUpdateWritesNoAudit() {
        StorageLocation drawer = location("Safe Drawer 1", true);
        when(locationRepository.findById(drawer.getId())).thenReturn(Optional.of(drawer));

        service.updateLocation(adminSession, drawer.getId(), new UpdateLocationRequest("Safe Drawer 1", true));

        verifyNoInteractions(auditLogService);
    }

    @Test
    void unknownLocationIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(locationRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateLocation(adminSession, missing, new UpdateLocationRequest("X", null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void retiredLocationCannotHoldNewItems() {
        UUID retired = UUID.randomUUID();
        when(locationRepository.findByIdAndActiveTrue(retired)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.requireActiveLocation(retired))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ProblemCode.VALIDATION_ERROR));
    }

    private static StorageLocation location(String name, boolean active) {
        StorageLocation location = new StorageLocation(name);
        location.setActive(active);
        ReflectionTestUtils.setField(location, "id", UUID.randomUUID());
        return location;
    }
}
