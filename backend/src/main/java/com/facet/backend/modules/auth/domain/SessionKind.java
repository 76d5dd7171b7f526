package com.facet.backend.modules.auth.domain;

/**
 * The two independent session families. Each has its own table, request header and idle window.
 */
public enum SessionKind {
    ADMIN("X-Admin-Session"),
    EMPLOYEE("X-Employee-Session");

    private final String headerName;

    SessionKind(String headerName) {
        this.headerName = headerName;
    }

    public String headerName() {
        return headerName;
    }
}
