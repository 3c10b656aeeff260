package com.carelink.backend.modules.verification.presentation.dto;

import java.time.OffsetDateTime;

/**
 * A null {@code expiresAt} clears the expiry.
 */
public record UpdateRequirementExpiryRequest(OffsetDateTime expiresAt) {
}
