package com.facet.backend.global.error;

/**
 * Stable error codes returned in {@link ProblemResponse#code()}. Clients branch on these, so never rename one.
 */
public final class ProblemCode {

    public static final String INVALID_PIN = "INVALID_PIN";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String CONFLICT = "CONFLICT";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String PHOTO_LIMIT = "PHOTO_LIMIT";
    public static final String SERVER_ERROR = "SERVER_ERROR";

    private ProblemCode() {
    }
}
