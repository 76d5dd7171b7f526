package com.facet.backend.modules.admin.presentation;

import java.util.List;
import java.util.UUID;

import com.facet.backend.global.security.SecurityUtils;
import com.facet.backend.modules.admin.application.AdminEmployeeService;
import com.facet.backend.modules.admin.presentation.dto.CreateEmployeeRequest;
import com.facet.backend.modules.admin.presentation.dto.EmployeeResponse;
import com.facet.backend.modules.admin.presentation.dto.ReactivateEmployeeRequest;
import com.facet.backend.modules.admin.presentation.dto.UpdateEmployeeRequest;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/employees")
public class AdminEmployeeController {

    private final AdminEmployeeService adminEmployeeService;

    public AdminEmployeeController(AdminEmployeeService adminEmployeeService) {
        this.adminEmployeeService = adminEmployeeService;
    }

    @GetMapping
    public ResponseEntity<List<EmployeeResponse>> listEmployees() {
        return ResponseEntity.ok(adminEmployeeService.listEmployees(SecurityUtils.getCurrentPrincipal()));
    }

    @PostMapping
    public ResponseEntity<EmployeeResponse> createEmployee(@Valid @RequestBody CreateEmployeeRequest request) {
        EmployeeResponse response = adminEmployeeService.createEmployee(SecurityUtils.getCurrentPrincipal(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{employeeId}")
    public ResponseEntity<EmployeeResponse> updateEmployee(
            @PathVariable UUID employeeId,
            @Valid @RequestBody UpdateEmployeeRequest request
    ) {
        return ResponseEntity.ok(adminEmployeeService.updateEmployee(SecurityUtils.getCurrentPrincipal(), employeeId, request));
    }

    @PostMapping("/{employeeId}/deactivate")
    public ResponseEntity<EmployeeResponse> deactivateEmployee(@PathVariable UUID employeeId) {
        return ResponseEntity.ok(adminEmployeeService.deactivateEmployee(SecurityUtils.getCurrentPrincipal(), employeeId));
    }

    @PostMapping("/{employeeId}/reactivate")
    public ResponseEntity<EmployeeResponse> reactivateEmployee(
            @PathVariable UUID employeeId,
            @Valid @RequestBody ReactivateEmployeeRequest request
    ) {
        return ResponseEntity.ok(adminEmployeeService.reactivateEmployee(SecurityUtils.getCurrentPrincipal(),
                employeeId, request));
    }
}
