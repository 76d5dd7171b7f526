package com.facet.backend.modules.admin.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.facet.backend.global.error.ProblemException;
import com.facet.backend.modules.admin.presentation.dto.CreateEmployeeRequest;
import com.facet.backend.modules.admin.presentation.dto.EmployeeResponse;
import com.facet.backend.modules.admin.presentation.dto.ReactivateEmployeeRequest;
import com.facet.backend.modules.admin.presentation.dto.UpdateEmployeeRequest;
import com.facet.backend.modules.audit.application.AuditLogService;
import com.facet.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.facet.backend.modules.auth.application.PinHasher;
import com.facet.backend.modules.auth.application.PinPolicy;
import com.facet.backend.modules.auth.application.PinProperties;
import com.facet.backend.modules.auth.application.RequestGate;
import com.facet.backend.modules.auth.application.SessionStore;
import com.facet.backend.modules.auth.domain.Employee;
import com.facet.backend.modules.auth.domain.Permission;
import com.facet.backend.modules.auth.domain.SessionPrincipal;
import com.facet.backend.modules.auth.infrastructure.persistence.EmployeeRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AdminEmployeeService {

    private static final Logger log = LoggerFactory.getLogger(AdminEmployeeService.class);
    private static final String RESOURCE_TYPE = "EMPLOYEE";

    private final EmployeeRepository employeeRepository;
    private final SessionStore sessionStore;
    private final PinHasher pinHasher;
    private final PinProperties pinProperties;
    private final RequestGate requestGate;
    private final AuditLogService auditLogService;

    public AdminEmployeeService(
            EmployeeRepository employeeRepository,
            SessionStore sessionStore,
            PinHasher pinHasher,
            PinProperties pinProperties,
            RequestGate requestGate,
            AuditLogService auditLogService
    ) {
        this.employeeRepository = employeeRepository;
        this.sessionStore = sessionStore;
        this.pinHasher = pinHasher;
        this.pinProperties = pinProperties;
        this.requestGate = requestGate;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public List<EmployeeResponse> listEmployees(SessionPrincipal actor) {
        requestGate.authorize(actor, Permission.MANAGE_EMPLOYEES).orThrow();
        return employeeRepository.findAllByOrderByNameAsc().stream()
                .map(EmployeeResponse::from)
                .toList();
    }

    public EmployeeResponse createEmployee(SessionPrincipal actor, @NonNull CreateEmployeeRequest request) {
        requestGate.authorize(actor, Permission.MANAGE_EMPLOYEES).orThrow();
        String name = requireName(request.name());
        ensurePinAcceptable(request.pin(), null);

        Employee employee = new Employee();
        employee.setName(name);
        employee.setRole(request.role());
        employee.setPinHash(pinHasher.hash(request.pin()));
        employee.setActive(true);
        employeeRepository.save(employee);

        auditLogService.record(new AuditLogCommand("EMPLOYEE_CREATED", RESOURCE_TYPE, employee.getId().toString(),
                actor, Map.of("name", name, "role", employee.getRole().name())));
        log.info("Created employee {} with role {}", employee.getId(), employee.getRole());
        return EmployeeResponse.from(employee);
    }

    public EmployeeResponse updateEmployee(SessionPrincipal actor, @NonNull UUID employeeId,
                                           @NonNull UpdateEmployeeRequest request) {
        requestGate.authorize(actor, Permission.MANAGE_EMPLOYEES).orThrow();
        Employee employee = findEmployeeForUpdate(employeeId);

        if (request.name() != null) {
            employee.setName(requireName(request.name()));
        }
        if (request.role() != null && request.role() != employee.getRole()) {
            auditLogService.record(new AuditLogCommand("EMPLOYEE_ROLE_CHANGED", RESOURCE_TYPE, employeeId.toString(),
                    actor, Map.of("from", employee.getRole().name(), "to", request.role().name())));
            employee.setRole(request.role());
        }
        if (request.pin() != null) {
            ensurePinAcceptable(request.pin(), employeeId);
            employee.setPinHash(pinHasher.hash(request.pin()));
            // sessions opened with the old PIN do not survive a reset
            sessionStore.revokeAllForEmployee(employeeId);
            auditLogService.record(new AuditLogCommand("EMPLOYEE_PIN_RESET", RESOURCE_TYPE, employeeId.toString(),
                    actor, Map.of()));
        }
        return EmployeeResponse.from(employee);
    }

    /**
     * Deactivates the employee and deletes every session they hold, in the same transaction.
     * Deactivating an already inactive employee is a no-op.
     */
    public EmployeeResponse deactivateEmployee(SessionPrincipal actor, @NonNull UUID employeeId) {
        requestGate.authorize(actor, Permission.MANAGE_EMPLOYEES).orThrow();
        Employee employee = findEmployeeForUpdate(employeeId);
        if (!employee.isActive()) {
            return EmployeeResponse.from(employee);
        }

        employee.setActive(false);
        int revoked = sessionStore.revokeAllForEmployee(employeeId);

        auditLogService.record(new AuditLogCommand("EMPLOYEE_DEACTIVATED", RESOURCE_TYPE, employeeId.toString(),
                actor, Map.of("revokedSessions", revoked)));
        log.info("Deactivated employee {} and revoked {} session(s)", employeeId, revoked);
        return EmployeeResponse.from(employee);
    }

    /**
     * Turns a deactivated employee back on with a freshly issued PIN. The stored hash cannot be checked against
     * PINs handed out while the employee was inactive, so the previous PIN is never revived.
     */
    public EmployeeResponse reactivateEmployee(SessionPrincipal actor, @NonNull UUID employeeId,
                                               ReactivateEmployeeRequest request) {
        requestGate.authorize(actor, Permission.MANAGE_EMPLOYEES).orThrow();
        Employee employee = findEmployeeForUpdate(employeeId);
        if (employee.isActive()) {
            return EmployeeResponse.from(employee);
        }
        ensurePinAcceptable(request.pin(), employeeId);
        employee.setPinHash(pinHasher.hash(request.pin()));
        employee.setActive(true);
        auditLogService.record(new AuditLogCommand("EMPLOYEE_REACTIVATED", RESOURCE_TYPE, employeeId.toString(),
                actor, Map.of("pinReset", true)));
        return EmployeeResponse.from(employee);
    }

    private Employee findEmployeeForUpdate(UUID employeeId) {
        return employeeRepository.findByIdForUpdate(employeeId)
                .orElseThrow(() -> ProblemException.notFound("Employee not found"));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw ProblemException.validation("Name must not be blank");
        }
        return name.strip();
    }

    private void ensurePinAcceptable(String pin, UUID excludeEmployeeId) {
        String reason = PinPolicy.validateAndReason(pin, pinProperties.minLength());
        if (reason != null) {
            throw ProblemException.validation(reason);
        }
        // PIN verification identifies the employee by PIN alone, so two active employees cannot share one
        for (Employee other : employeeRepository.findByActiveTrueOrderByCreatedAtAsc()) {
            if (!other.getId().equals(excludeEmployeeId) && pinHasher.verify(pin, other.getPinHash())) {
                throw ProblemException.conflict("PIN is already assigned to another employee");
            }
        }
    }
}
