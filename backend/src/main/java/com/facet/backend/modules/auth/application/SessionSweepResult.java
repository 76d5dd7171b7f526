package com.facet.backend.modules.auth.application;

public record SessionSweepResult(int adminSessions, int employeeSessions) {

    public int total() {
        return adminSessions + employeeSessions;
    }
}
