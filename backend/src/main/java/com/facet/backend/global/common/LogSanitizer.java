package com.facet.backend.global.common;

/**
 * Neutralises client-supplied text before it reaches log lines or audit records.
 */
public final class LogSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 256;

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        return sanitize(value, DEFAULT_MAX_LENGTH);
    }

    public static String sanitize(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        StringBuilder sb = new StringBuilder(Math.min(value.length(), maxLength));
        for (int i = 0; i < value.length() && sb.length() < maxLength; i++) {
            char c = value.charAt(i);
            // CR/LF would let a value forge additional log lines
            if (Character.isISOControl(c) || c == '\u2028' || c == '\u2029') {
                sb.append('_');
            } else {
                sb.append(c);
            }
        }
        if (value.length() > maxLength) {
            sb.append("...");
        }
        return sb.toString();
    }
}
