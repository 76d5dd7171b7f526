package com.facet.backend.modules.admin.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StoreSettingsTest {

    @Test
    void ticketCodesAreSequentialAndPadded() {
        StoreSettings settings = new StoreSettings();
        settings.setTicketPrefix("FCT");

        assertThat(settings.allocateTicketCode()).isEqualTo("FCT-00001");
        assertThat(settings.allocateTicketCode()).isEqualTo("FCT-00002");
        assertThat(settings.getNextTicketNumber()).isEqualTo(3);
    }
}
