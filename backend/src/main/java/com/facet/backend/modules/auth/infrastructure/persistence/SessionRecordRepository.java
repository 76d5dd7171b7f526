package com.facet.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.auth.domain.AbstractSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

/**
 * Queries shared by both session tables.
 */
@NoRepositoryBean
public interface SessionRecordRepository<S extends AbstractSession> extends JpaRepository<S, UUID> {

    Optional<S> findByTokenHash(String tokenHash);

    /**
     * Slides the expiry of a live session in one statement, so a concurrent revoke either wins
     * (no row to update) or waits for the row lock.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update #{#entityName} s
               set s.lastActivityAt = :now,
                   s.expiresAt = :expiresAt
             where s.tokenHash = :tokenHash
               and s.expiresAt > :now
            """)
    int touch(@Param("tokenHash") String tokenHash,
              @Param("now") OffsetDateTime now,
              @Param("expiresAt") OffsetDateTime expiresAt);

    @Modifying
    @Query("delete from #{#entityName} s where s.tokenHash = :tokenHash")
    int deleteByTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying
    @Query("delete from #{#entityName} s where s.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
