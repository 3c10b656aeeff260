package com.carelink.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.error.RetryableProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.auth.presentation.dto.LoginRequest;
import com.carelink.backend.modules.auth.presentation.dto.LoginResponse;
import com.carelink.backend.modules.auth.presentation.dto.LogoutRequest;
import com.carelink.backend.modules.auth.presentation.dto.RefreshRequest;
import com.carelink.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.carelink.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.carelink.backend.modules.profile.application.ProfileService;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserSession;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Password login with lockout, refresh token rotation and logout.
 * Failures are raised after the failed-attempt counter is updated, so the transaction must not roll back on them.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final AuditLogService auditLogService;
    private final ProfileService profileService;
    private final Clock clock;
    private final int maxFailedAttempts;
    private final Duration lockDuration;

    public AuthService(
            UserRepository userRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            AuditLogService auditLogService,
            ProfileService profileService,
            Clock clock,
            @Value("${app.auth.lockout.max-attempts:5}") int maxFailedAttempts,
            @Value("${app.auth.lockout.duration-minutes:15}") long lockDurationMinutes
    ) {
        this.userRepository = userRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.auditLogService = auditLogService;
        this.profileService = profileService;
        this.clock = clock;
        this.maxFailedAttempts = maxFailedAttempts;
        this.lockDuration = Duration.ofMinutes(lockDurationMinutes);
    }

    public LoginResponse login(LoginRequest request, ClientRequestInfo client) {
        String email = normalizeEmail(request.email());
        OffsetDateTime now = OffsetDateTime.now(clock);

        User user = userRepository.findByEmailIgnoreCase(email).orElse(null);
        if (user == null || user.getPasswordHash() == null) {
            auditLogService.recordQuietly(AuditLogCommand.of(
                    AuditAction.LOGIN_FAILED, null, client, Map.of("email", email, "reason", "UNKNOWN_ACCOUNT")));
            throw invalidCredentials();
        }

        if (user.isLockedAt(now)) {
            throw new RetryableProblemException(HttpStatus.LOCKED, "ACCOUNT_LOCKED",
                    "Account temporarily locked after repeated failed logins",
                    Duration.between(now, user.getAccountLockedUntil()));
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            boolean lockedNow = user.registerFailedLogin(now, maxFailedAttempts, lockDuration);
            userRepository.save(user);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("reason", "BAD_PASSWORD");
            metadata.put("failedAttempts", user.getFailedLoginAttempts());
            auditLogService.recordQuietly(AuditLogCommand.of(AuditAction.LOGIN_FAILED, user.getId(), client, metadata));

            if (lockedNow) {
                log.warn("Account {} locked until {} after {} failed logins",
                        user.getId(), user.getAccountLockedUntil(), user.getFailedLoginAttempts());
                auditLogService.recordQuietly(AuditLogCommand.of(AuditAction.ACCOUNT_LOCKED, user.getId(), client,
                        Map.of("lockedUntil", user.getAccountLockedUntil().toString())));
            }
            throw invalidCredentials();
        }

        if (user.getStatus() != AccountStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ACCOUNT_" + user.getStatus().name(),
                    "Account is not active");
        }

        user.registerSuccessfulLogin(now, client.ipAddress());
        userRepository.save(user);
        revokeExpiredSessions(user.getId(), now);

        String refreshToken = SecureTokens.randomHex();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), user.getRole().name(), refreshToken);
        persistSession(user, refreshToken, tokens, normalizeDeviceId(request.deviceId()), client);

        auditLogService.record(AuditLogCommand.of(AuditAction.LOGIN_SUCCESS, user.getId(), client, Map.of()));
        return new LoginResponse(tokens, buildUserProfile(user));
    }

    public LoginResponse refresh(RefreshRequest request, ClientRequestInfo client) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findBySessionTokenHash(SecureTokens.sha256Hex(request.refreshToken()))
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.isRevoked()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (session.isExpiredAt(now)) {
            session.revoke(now, REASON_EXPIRED);
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId == null || requestDeviceId == null || !Objects.equals(sessionDeviceId, requestDeviceId)) {
            session.revoke(now, REASON_DEVICE_MISMATCH);
            log.warn("Refresh token for user {} presented from a different device", session.getUser().getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_DEVICE_MISMATCH");
        }

        User user = session.getUser();
        if (user.getStatus() != AccountStatus.ACTIVE) {
            session.revoke(now, REASON_USER_INACTIVE);
            throw new ProblemException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        // A refresh token is single use; the presented one is retired before the new pair is issued.
        session.revoke(now, REASON_ROTATED);
        revokeExpiredSessions(user.getId(), now);

        String refreshToken = SecureTokens.randomHex();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), user.getRole().name(), refreshToken);
        persistSession(user, refreshToken, tokens, requestDeviceId, client);

        return new LoginResponse(tokens, buildUserProfile(user));
    }

    public void logout(LogoutRequest request, ClientRequestInfo client) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.findBySessionTokenHash(SecureTokens.sha256Hex(request.refreshToken()))
                .filter(session -> !session.isRevoked())
                .ifPresent(session -> {
                    session.revoke(now, REASON_LOGOUT);
                    auditLogService.record(AuditLogCommand.of(AuditAction.LOGOUT, session.getUser().getId(), client, Map.of()));
                });
        // Unknown tokens get the same response so token validity is not disclosed.
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        return buildUserProfile(user);
    }

    private UserProfileResponse buildUserProfile(User user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getRole().name(),
                user.getStatus().name(),
                user.isEmailVerified(),
                profileService.resolveDisplayName(user),
                user.getLastLoginAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private void persistSession(User user, String refreshToken, TokenPairResponse tokens, String deviceId, ClientRequestInfo client) {
        OffsetDateTime issuedAt = tokens.issuedAt();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setSessionTokenHash(SecureTokens.sha256Hex(refreshToken));
        session.setIssuedAt(issuedAt);
        session.setExpires(issuedAt.plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);
        session.setIpAddress(client.ipAddress());
        session.setUserAgent(client.userAgent());

        userSessionRepository.save(session);
    }

    private void revokeExpiredSessions(UUID userId, OffsetDateTime now) {
        userSessionRepository.revokeExpiredSessions(userId, now, REASON_EXPIRED);
    }

    private ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Invalid email or password");
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }
}
