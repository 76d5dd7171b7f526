package com.facet.backend.modules.auth.domain;

public enum EmployeeRole {
    STAFF,
    ADMIN
}
