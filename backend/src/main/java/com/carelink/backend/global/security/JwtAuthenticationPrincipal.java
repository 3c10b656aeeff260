package com.carelink.backend.global.security;

import java.util.UUID;

/**
 * Identity taken from a verified access token. No database lookup backs it, so a role change
 * takes effect when the user's next access token is issued.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email, String role) {
}
