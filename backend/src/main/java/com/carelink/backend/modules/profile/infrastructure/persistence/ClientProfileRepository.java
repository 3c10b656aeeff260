package com.carelink.backend.modules.profile.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.ClientProfile;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ClientProfileRepository extends JpaRepository<ClientProfile, UUID> {

    Optional<ClientProfile> findByUserId(UUID userId);
}
