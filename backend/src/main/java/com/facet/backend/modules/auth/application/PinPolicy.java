package com.facet.backend.modules.auth.application;

import java.util.List;
import java.util.Locale;

/**
 * Strength rules applied whenever a PIN is set or changed.
 */
public final class PinPolicy {

    private static final List<String> WEAK_PATTERNS = List.of(
            "000000", "111111", "222222", "333333", "444444",
            "555555", "666666", "777777", "888888", "999999",
            "123456", "654321", "012345", "543210", "123123",
            "111222", "112233", "121212",
            "abcdef", "qwerty", "password", "changeme"
    );

    private PinPolicy() {
    }

    /**
     * @return {@code null} when acceptable, otherwise a short reason safe to show the admin
     */
    public static String validateAndReason(String pin, int minLength) {
        if (pin == null || pin.isBlank()) {
            return "PIN is required";
        }
        if (pin.length() < minLength) {
            return "PIN must be at least " + minLength + " characters";
        }
        if (!pin.equals(pin.strip())) {
            return "PIN must not start or end with whitespace";
        }
        String normalized = pin.toLowerCase(Locale.ROOT);
        for (String weak : WEAK_PATTERNS) {
            if (normalized.equals(weak) || normalized.startsWith(weak)) {
                return "PIN is too easy to guess";
            }
        }
        if (normalized.chars().distinct().count() == 1) {
            return "PIN must not repeat a single character";
        }
        return null;
    }

    public static boolean isAcceptable(String pin, int minLength) {
        return validateAndReason(pin, minLength) == null;
    }
}
