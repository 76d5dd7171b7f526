package com.facet.backend.modules.auth.infrastructure.persistence;

import com.facet.backend.modules.auth.domain.AdminSession;

import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdminSessionRepository extends SessionRecordRepository<AdminSession> {

    @Modifying
    @Query("delete from AdminSession s where s.tokenHash <> :keepTokenHash")
    int deleteAllExcept(@Param("keepTokenHash") String keepTokenHash);
}
