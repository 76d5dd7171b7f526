package com.facet.backend.modules.ticket.application;

import java.nio.file.Path;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "facet.photos")
public record PhotoProperties(
        @DefaultValue("10485760") long maxSizeBytes,
        @DefaultValue("./data/photos") Path storageDir
) {

    public PhotoProperties {
        if (maxSizeBytes < 1) {
            throw new IllegalArgumentException("facet.photos.max-size-bytes must be positive");
        }
    }
}
