package com.carelink.backend.modules.profile.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.CoordinatorProfile;

import org.springframework.data.jpa.repository.JpaRepository;

public interface CoordinatorProfileRepository extends JpaRepository<CoordinatorProfile, UUID> {

    Optional<CoordinatorProfile> findByUserId(UUID userId);
}
