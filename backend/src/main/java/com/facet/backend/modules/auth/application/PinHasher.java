package com.facet.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Hashes and verifies PINs with the memory-hard encoder configured in
 * {@link com.facet.backend.global.security.SecurityConfig}. Stored blobs are self-describing
 * (algorithm, parameters and salt), so parameters can change without invalidating old hashes.
 */
@Component
public class PinHasher {

    private static final Logger log = LoggerFactory.getLogger(PinHasher.class);

    private final PasswordEncoder passwordEncoder;

    public PinHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String pin) {
        if (pin == null || pin.isEmpty()) {
            throw new IllegalArgumentException("pin must not be empty");
        }
        return passwordEncoder.encode(pin);
    }

    /**
     * Fails closed: a missing or malformed stored hash verifies as {@code false}.
     */
    public boolean verify(String pin, String storedHash) {
        if (pin == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(pin, storedHash);
        } catch (RuntimeException ex) {
            log.warn("Stored PIN hash could not be parsed: {}", ex.getClass().getSimpleName());
            return false;
        }
    }
}
