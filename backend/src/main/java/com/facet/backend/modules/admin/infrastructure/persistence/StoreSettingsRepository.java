package com.facet.backend.modules.admin.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.admin.domain.StoreSettings;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;

/**
 * The table holds at most one row (enforced by a unique constraint on a constant column).
 */
public interface StoreSettingsRepository extends JpaRepository<StoreSettings, UUID> {

    @Query("select s from StoreSettings s")
    Optional<StoreSettings> findSingleton();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StoreSettings s")
    Optional<StoreSettings> findSingletonForUpdate();
}
