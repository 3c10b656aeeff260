package com.carelink.backend.modules.user.infrastructure.persistence;

import java.util.Optional;

import com.carelink.backend.modules.user.domain.VerificationToken;
import com.carelink.backend.modules.user.domain.VerificationTokenId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VerificationTokenRepository extends JpaRepository<VerificationToken, VerificationTokenId> {

    Optional<VerificationToken> findByIdentifierAndToken(String identifier, String token);

    @Modifying
    @Query("delete from VerificationToken vt where vt.identifier = :identifier")
    int deleteAllByIdentifier(@Param("identifier") String identifier);
}
