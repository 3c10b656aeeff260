package com.carelink.backend.modules.user.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.user.domain.UserSession;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @EntityGraph(attributePaths = "user")
    Optional<UserSession> findBySessionTokenHash(String sessionTokenHash);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expires <= :now
            """)
    int revokeExpiredSessions(@Param("userId") UUID userId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeAllForUser(@Param("userId") UUID userId,
                         @Param("now") OffsetDateTime now,
                         @Param("reason") String reason);
}
