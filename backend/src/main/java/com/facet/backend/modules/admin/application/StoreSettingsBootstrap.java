package com.facet.backend.modules.admin.application;

import com.facet.backend.modules.admin.domain.StoreSettings;
import com.facet.backend.modules.admin.infrastructure.persistence.StoreSettingsRepository;
import com.facet.backend.modules.auth.application.PinHasher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the settings row on first start, with the configured initial admin PIN.
 * {@code setup_complete} stays false until an admin replaces that PIN.
 */
@Component
public class StoreSettingsBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StoreSettingsBootstrap.class);

    private final StoreSettingsRepository storeSettingsRepository;
    private final PinHasher pinHasher;
    private final String initialPin;
    private final String storeName;

    public StoreSettingsBootstrap(
            StoreSettingsRepository storeSettingsRepository,
            PinHasher pinHasher,
            @Value("${facet.admin.initial-pin:}") String initialPin,
            @Value("${facet.store.name:Repair Shop}") String storeName
    ) {
        this.storeSettingsRepository = storeSettingsRepository;
        this.pinHasher = pinHasher;
        this.initialPin = initialPin;
        this.storeName = storeName;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (storeSettingsRepository.count() > 0) {
            return;
        }
        if (initialPin == null || initialPin.isBlank()) {
            throw new IllegalStateException("facet.admin.initial-pin must be set to initialise store settings");
        }
        StoreSettings settings = new StoreSettings();
        settings.setStoreName(storeName);
        settings.setAdminPinHash(pinHasher.hash(initialPin));
        settings.setSetupComplete(false);
        storeSettingsRepository.save(settings);
        log.warn("Initialised store settings with the configured initial admin PIN; change it before going live");
    }
}
