package com.facet.backend.modules.auth.application;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "facet.pin")
public record PinProperties(@DefaultValue("6") int minLength) {

    public PinProperties {
        if (minLength < 4) {
            throw new IllegalArgumentException("facet.pin.min-length must be at least 4");
        }
    }
}
