package com.facet.backend.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests.
 * The container is started once per JVM so cached Spring contexts keep pointing at a live database.
 * Classes are skipped when no Docker daemon is reachable.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    public static final String INITIAL_ADMIN_PIN = "482917";

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("facet_test")
            .withUsername("facet_user")
            .withPassword("facet_password");

    private static final Object START_LOCK = new Object();
    private static Path photoDir;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        synchronized (START_LOCK) {
            if (!POSTGRES.isRunning()) {
                POSTGRES.start();
            }
            if (photoDir == null) {
                try {
                    photoDir = Files.createTempDirectory("facet-photos");
                } catch (IOException ex) {
                    throw new UncheckedIOException("Failed to create photo directory for tests", ex);
                }
            }
        }

        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);

        registry.add("spring.flyway.url", POSTGRES::getJdbcUrl);
        registry.add("spring.flyway.user", POSTGRES::getUsername);
        registry.add("spring.flyway.password", POSTGRES::getPassword);

        registry.add("facet.admin.initial-pin", () -> INITIAL_ADMIN_PIN);
        registry.add("facet.scheduling.enabled", () -> "false");
        // every MockMvc request shares one client address
        registry.add("facet.rate-limit.max-attempts", () -> "1000");
        registry.add("facet.photos.storage-dir", () -> photoDir.toString());
    }

    /**
     * Store settings survive between tests; everything created through the API does not.
     */
    @AfterEach
    void resetData() {
        jdbcTemplate.execute("""
                TRUNCATE TABLE audit_log, ticket_photos, ticket_notes, ticket_field_history,
                    ticket_status_history, tickets, storage_locations, employee_sessions, admin_sessions, employees
                """);
    }
}
