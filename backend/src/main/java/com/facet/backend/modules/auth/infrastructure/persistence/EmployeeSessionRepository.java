package com.facet.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.EmployeeSession;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EmployeeSessionRepository extends SessionRecordRepository<EmployeeSession> {

    /**
     * Like {@link #touch} but also requires the bound employee to still be active.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update EmployeeSession s
               set s.lastActivityAt = :now,
                   s.expiresAt = :expiresAt
             where s.tokenHash = :tokenHash
               and s.expiresAt > :now
               and exists (
                    select 1 from Employee e
                     where e.id = s.employee.id
                       and e.active = true
               )
            """)
    int touchForActiveEmployee(@Param("tokenHash") String tokenHash,
                               @Param("now") OffsetDateTime now,
                               @Param("expiresAt") OffsetDateTime expiresAt);

    @Query("""
            select s
              from EmployeeSession s
              join fetch s.employee e
             where s.tokenHash = :tokenHash
            """)
    Optional<EmployeeSession> findWithEmployeeByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from EmployeeSession s where s.employee.id = :employeeId")
    int deleteAllByEmployeeId(@Param("employeeId") UUID employeeId);
}
