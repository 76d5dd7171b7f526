package com.facet.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

@Entity
@Table(name = "employee_sessions")
public class EmployeeSession extends AbstractSession {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "employee_id", nullable = false, updatable = false)
    private Employee employee;

    protected EmployeeSession() {
    }

    public EmployeeSession(Employee employee, String tokenHash, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        super(tokenHash, createdAt, expiresAt);
        this.employee = employee;
    }

    public Employee getEmployee() {
        return employee;
    }
}
