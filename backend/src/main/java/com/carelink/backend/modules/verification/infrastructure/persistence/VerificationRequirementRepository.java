package com.carelink.backend.modules.verification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.verification.domain.RequirementStatus;
import com.carelink.backend.modules.verification.domain.VerificationRequirement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VerificationRequirementRepository extends JpaRepository<VerificationRequirement, UUID> {

    List<VerificationRequirement> findByWorkerProfileIdOrderByCreatedAtDesc(UUID workerProfileId);

    List<VerificationRequirement> findByWorkerProfileIdAndRequirementTypeInOrderByCreatedAtDesc(
            UUID workerProfileId,
            Collection<String> requirementTypes
    );

    Optional<VerificationRequirement> findByWorkerProfileIdAndRequirementType(UUID workerProfileId, String requirementType);

    Optional<VerificationRequirement> findByIdAndWorkerProfileId(UUID id, UUID workerProfileId);

    List<VerificationRequirement> findByWorkerProfileIdAndStatus(UUID workerProfileId, RequirementStatus status);

    boolean existsByWorkerProfileIdAndStatus(UUID workerProfileId, RequirementStatus status);

    @Modifying
    @Query("""
            update VerificationRequirement vr
               set vr.status = com.carelink.backend.modules.verification.domain.RequirementStatus.EXPIRED,
                   vr.updatedAt = :now
             where vr.status = com.carelink.backend.modules.verification.domain.RequirementStatus.APPROVED
               and vr.expiresAt is not null
               and vr.expiresAt < :now
            """)
    int expireApprovedBefore(@Param("now") OffsetDateTime now);
}
