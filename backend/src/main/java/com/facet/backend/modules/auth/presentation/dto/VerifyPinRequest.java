package com.facet.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record VerifyPinRequest(
        @NotBlank
        @Size(max = 128)
        String pin
) {

    @Override
    public String toString() {
        return "VerifyPinRequest[pin=***]";
    }
}
