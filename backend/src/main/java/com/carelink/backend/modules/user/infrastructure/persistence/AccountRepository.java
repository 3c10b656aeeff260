package com.carelink.backend.modules.user.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.modules.user.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    List<Account> findByUserIdOrderByProviderAsc(UUID userId);

    Optional<Account> findByIdAndUserId(UUID id, UUID userId);

    boolean existsByProviderAndProviderAccountId(String provider, String providerAccountId);
}
