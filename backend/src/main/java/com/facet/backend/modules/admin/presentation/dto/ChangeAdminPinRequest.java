package com.facet.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangeAdminPinRequest(
        @NotBlank
        @Size(max = 128)
        String currentPin,
        @NotBlank
        @Size(max = 128)
        String newPin
) {

    @Override
    public String toString() {
        return "ChangeAdminPinRequest[***]";
    }
}
