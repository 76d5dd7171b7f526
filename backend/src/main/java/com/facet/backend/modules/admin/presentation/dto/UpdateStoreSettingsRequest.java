package com.facet.backend.modules.admin.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Omitted fields stay unchanged.
 */
public record UpdateStoreSettingsRequest(
        @Size(min = 1, max = 120)
        String storeName,
        @Size(max = 40)
        String storePhone,
        @Size(max = 255)
        String storeAddress,
        @Pattern(regexp = "[A-Z]{3}")
        String currency,
        @Pattern(regexp = "[A-Z0-9]{1,8}")
        String ticketPrefix,
        @Min(1)
        @Max(50)
        Integer maxPhotosPerTicket
) {
}
