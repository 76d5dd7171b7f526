package com.facet.backend.modules.location.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.facet.backend.modules.location.domain.StorageLocation;

import org.springframework.data.jpa.repository.JpaRepository;

public interface StorageLocationRepository extends JpaRepository<StorageLocation, UUID> {

    List<StorageLocation> findAllByOrderByNameAsc();

    List<StorageLocation> findByActiveTrueOrderByNameAsc();

    Optional<StorageLocation> findByNameIgnoreCase(String name);

    Optional<StorageLocation> findByIdAndActiveTrue(UUID id);
}
