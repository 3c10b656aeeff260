package com.carelink.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Access to the JWT principal of the current request thread.
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_REQUIRED"));
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    /**
     * @throws ProblemException 401 when the request carries no valid access token
     */
    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }
}
