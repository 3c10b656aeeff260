package com.carelink.backend.modules.user.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.carelink.backend.modules.user.domain.Account;

public record LinkedAccountResponse(
        UUID id,
        String provider,
        String providerAccountId,
        String type,
        OffsetDateTime linkedAt
) {

    public static LinkedAccountResponse from(Account account) {
        return new LinkedAccountResponse(
                account.getId(),
                account.getProvider(),
                account.getProviderAccountId(),
                account.getType(),
                account.getCreatedAt()
        );
    }
}
