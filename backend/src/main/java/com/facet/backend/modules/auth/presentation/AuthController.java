package com.facet.backend.modules.auth.presentation;

import com.facet.backend.global.web.ClientAddressResolver;
import com.facet.backend.modules.auth.application.AuthService;
import com.facet.backend.modules.auth.domain.SessionKind;
import com.facet.backend.modules.auth.presentation.dto.AdminSessionResponse;
import com.facet.backend.modules.auth.presentation.dto.EmployeeSessionResponse;
import com.facet.backend.modules.auth.presentation.dto.VerifyPinRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private final AuthService authService;
    private final ClientAddressResolver clientAddressResolver;

    public AuthController(AuthService authService, ClientAddressResolver clientAddressResolver) {
        this.authService = authService;
        this.clientAddressResolver = clientAddressResolver;
    }

    @Operation(summary = "Verify admin PIN", description = "Issues an admin session token on success.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Admin session issued"),
            @ApiResponse(responseCode = "401", description = "`INVALID_PIN`"),
            @ApiResponse(responseCode = "429", description = "`RATE_LIMITED`, see the `Retry-After` header")
    })
    @PostMapping("/admin/verify")
    public ResponseEntity<AdminSessionResponse> verifyAdmin(
            @Valid @RequestBody VerifyPinRequest request,
            HttpServletRequest servletRequest
    ) {
        String sourceKey = "admin:" + clientAddressResolver.resolve(servletRequest);
        return ResponseEntity.ok(authService.verifyAdminPin(request.pin(), sourceKey));
    }

    @Operation(summary = "Verify employee PIN", description = "The PIN alone identifies the employee.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Employee session issued"),
            @ApiResponse(responseCode = "401", description = "`INVALID_PIN`"),
            @ApiResponse(responseCode = "429", description = "`RATE_LIMITED`, see the `Retry-After` header")
    })
    @PostMapping("/employee/verify")
    public ResponseEntity<EmployeeSessionResponse> verifyEmployee(
            @Valid @RequestBody VerifyPinRequest request,
            HttpServletRequest servletRequest
    ) {
        String sourceKey = "employee:" + clientAddressResolver.resolve(servletRequest);
        return ResponseEntity.ok(authService.verifyEmployeePin(request.pin(), sourceKey));
    }

    @PostMapping("/admin/logout")
    public ResponseEntity<Void> logoutAdmin(
            @RequestHeader(name = "X-Admin-Session", required = false) String token
    ) {
        authService.logout(token, SessionKind.ADMIN);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/employee/logout")
    public ResponseEntity<Void> logoutEmployee(
            @RequestHeader(name = "X-Employee-Session", required = false) String token
    ) {
        authService.logout(token, SessionKind.EMPLOYEE);
        return ResponseEntity.noContent().build();
    }
}
