package com.facet.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or obviously unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "facet.photos.storage-dir",
            "app.cors.allowed-origins"
    };

    private static final String[] DURATION_PROPERTIES = {
            "facet.session.admin-idle-timeout",
            "facet.session.employee-idle-timeout",
            "facet.rate-limit.window"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        for (String key : DURATION_PROPERTIES) {
            String raw = environment.getProperty(key);
            if (raw == null) {
                continue;
            }
            try {
                Duration duration = Duration.parse(raw.trim());
                if (duration.isNegative() || duration.isZero()) {
                    problems.add(key + ": must be positive");
                }
            } catch (DateTimeParseException ex) {
                problems.add(key + ": not an ISO-8601 duration");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", problems));
        }
        log.info("Configuration validated");
    }
}
