package com.carelink.backend.modules.profile.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.VerificationStatus;
import com.carelink.backend.modules.profile.domain.WorkerProfile;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkerProfileRepository extends JpaRepository<WorkerProfile, UUID> {

    @EntityGraph(attributePaths = "user")
    Optional<WorkerProfile> findByUserId(UUID userId);

    @EntityGraph(attributePaths = "user")
    @Query("select wp from WorkerProfile wp where wp.id = :id")
    Optional<WorkerProfile> findWithUserById(@Param("id") UUID id);

    @EntityGraph(attributePaths = "user")
    @Query("""
            select wp
              from WorkerProfile wp
             where wp.verificationStatus = com.carelink.backend.modules.profile.domain.VerificationStatus.PENDING_REVIEW
             order by wp.verificationSubmittedAt asc nulls last
            """)
    List<WorkerProfile> findAwaitingReview();

    @EntityGraph(attributePaths = "user")
    @Query("""
            select wp
              from WorkerProfile wp
             where wp.verificationStatus = :status
             order by wp.updatedAt desc
            """)
    List<WorkerProfile> findByVerificationStatus(@Param("status") VerificationStatus status);

    /**
     * Directory listing for clients and coordinators: published, approved workers of active accounts.
     * Every argument is non-null; an empty string disables that filter. {@code services} is a
     * {@code |}-joined list matched against the profile's services by overlap.
     */
    @Query(value = """
            select wp.*
              from worker_profile wp
              join app_user u on u.id = wp.user_id
             where wp.is_published = true
               and wp.verification_status = 'APPROVED'
               and u.status = 'ACTIVE'
               and (:textPattern = ''
                    or wp.first_name ilike :textPattern
                    or wp.last_name ilike :textPattern
                    or wp.introduction ilike :textPattern)
               and (:locationPattern = ''
                    or wp.location ilike :locationPattern
                    or wp.city ilike :locationPattern
                    or wp.state ilike :locationPattern
                    or wp.postal_code ilike :locationPattern)
               and (:services = '' or wp.services && string_to_array(:services, '|'))
             order by wp.created_at desc, wp.id
            """,
            countQuery = """
            select count(*)
              from worker_profile wp
              join app_user u on u.id = wp.user_id
             where wp.is_published = true
               and wp.verification_status = 'APPROVED'
               and u.status = 'ACTIVE'
               and (:textPattern = ''
                    or wp.first_name ilike :textPattern
                    or wp.last_name ilike :textPattern
                    or wp.introduction ilike :textPattern)
               and (:locationPattern = ''
                    or wp.location ilike :locationPattern
                    or wp.city ilike :locationPattern
                    or wp.state ilike :locationPattern
                    or wp.postal_code ilike :locationPattern)
               and (:services = '' or wp.services && string_to_array(:services, '|'))
            """,
            nativeQuery = true)
    Page<WorkerProfile> searchPublished(
            @Param("textPattern") String textPattern,
            @Param("locationPattern") String locationPattern,
            @Param("services") String services,
            Pageable pageable
    );

    @Query("""
            select wp.verificationStatus, count(wp)
              from WorkerProfile wp
             group by wp.verificationStatus
            """)
    List<Object[]> countByVerificationStatus();
}
