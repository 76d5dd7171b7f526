package com.facet.backend.modules.admin.presentation.dto;

import com.facet.backend.modules.admin.domain.StoreSettings;

public record StoreSettingsResponse(
        String storeName,
        String storePhone,
        String storeAddress,
        String currency,
        String ticketPrefix,
        long nextTicketNumber,
        int maxPhotosPerTicket,
        boolean setupComplete
) {

    public static StoreSettingsResponse from(StoreSettings settings) {
        return new StoreSettingsResponse(settings.getStoreName(), settings.getStorePhone(), settings.getStoreAddress(),
                settings.getCurrency(), settings.getTicketPrefix(), settings.getNextTicketNumber(),
                settings.getMaxPhotosPerTicket(), settings.isSetupComplete());
    }
}
