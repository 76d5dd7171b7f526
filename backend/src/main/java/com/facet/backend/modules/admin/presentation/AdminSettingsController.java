package com.facet.backend.modules.admin.presentation;

import com.facet.backend.global.security.SecurityUtils;
import com.facet.backend.modules.admin.application.StoreSettingsService;
import com.facet.backend.modules.admin.presentation.dto.ChangeAdminPinRequest;
import com.facet.backend.modules.admin.presentation.dto.StoreSettingsResponse;
import com.facet.backend.modules.admin.presentation.dto.UpdateStoreSettingsRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/settings")
public class AdminSettingsController {

    private final StoreSettingsService storeSettingsService;

    public AdminSettingsController(StoreSettingsService storeSettingsService) {
        this.storeSettingsService = storeSettingsService;
    }

    @GetMapping
    public ResponseEntity<StoreSettingsResponse> getSettings() {
        return ResponseEntity.ok(storeSettingsService.getSettings(SecurityUtils.getCurrentPrincipal()));
    }

    @PutMapping
    public ResponseEntity<StoreSettingsResponse> updateSettings(@Valid @RequestBody UpdateStoreSettingsRequest request) {
        return ResponseEntity.ok(storeSettingsService.updateSettings(SecurityUtils.getCurrentPrincipal(), request));
    }

    @PostMapping("/pin")
    public ResponseEntity<Void> changeAdminPin(
            @Valid @RequestBody ChangeAdminPinRequest request,
            @RequestHeader("X-Admin-Session") String currentToken
    ) {
        storeSettingsService.changeAdminPin(SecurityUtils.getCurrentPrincipal(), request, currentToken);
        return ResponseEntity.noContent().build();
    }
}
