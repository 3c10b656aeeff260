package com.carelink.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.global.error.RetryableProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.auth.application.AuthService;
import com.carelink.backend.modules.auth.application.JwtTokenService;
import com.carelink.backend.modules.auth.application.SecureTokens;
import com.carelink.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.carelink.backend.modules.auth.presentation.dto.LoginRequest;
import com.carelink.backend.modules.auth.presentation.dto.LoginResponse;
import com.carelink.backend.modules.auth.presentation.dto.LogoutRequest;
import com.carelink.backend.modules.auth.presentation.dto.RefreshRequest;
import com.carelink.backend.modules.profile.application.ProfileService;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.domain.UserSession;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserSessionRepository;
import com.carelink.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String PASSWORD = "Str0ng!Pass";
    private static final String JWT_SECRET = "carelink-unit-test-secret-0123456789-abcdefghijklmnop";
    private static final ClientRequestInfo CLIENT = new ClientRequestInfo("203.0.113.10", "JUnit");

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserSessionRepository userSessionRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private ProfileService profileService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private Clock clock;
    private AuthService authService;
    private User user;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        JwtTokenService jwtTokenService = new JwtTokenService(
                new JwtTokenProvider(JWT_SECRET), 900_000L, 2_592_000_000L, clock);
        authService = new AuthService(
                userRepository,
                userSessionRepository,
                passwordEncoder,
                jwtTokenService,
                auditLogService,
                profileService,
                clock,
                5,
                15
        );

        user = new User();
        user.setEmail("alice@example.com");
        user.setPasswordHash(passwordEncoder.encode(PASSWORD));
        user.setRole(UserRole.WORKER);
        user.setStatus(AccountStatus.ACTIVE);
        TestEntities.withId(user, UUID.fromString("00000000-0000-0000-0000-000000000101"));

        lenient().when(userRepository.findByEmailIgnoreCase("alice@example.com")).thenReturn(Optional.of(user));
        lenient().when(profileService.resolveDisplayName(any(User.class))).thenReturn("Alice Smith");
    }

    @Test
    @DisplayName("successful login stores only the refresh token hash")
    void loginStoresHashedRefreshToken() {
        LoginResponse response = authService.login(new LoginRequest(" Alice@Example.com ", PASSWORD, "  device-1  "), CLIENT);

        assertThat(response.tokens().accessToken()).isNotBlank();
        assertThat(response.tokens().tokenType()).isEqualTo("Bearer");
        assertThat(response.tokens().expiresIn()).isEqualTo(900L);
        assertThat(response.user().displayName()).isEqualTo("Alice Smith");

        ArgumentCaptor<UserSession> captor = ArgumentCaptor.forClass(UserSession.class);
        verify(userSessionRepository).save(captor.capture());
        UserSession session = captor.getValue();
        assertThat(session.getSessionTokenHash()).isEqualTo(SecureTokens.sha256Hex(response.tokens().refreshToken()));
        assertThat(session.getSessionTokenHash()).isNotEqualTo(response.tokens().refreshToken());
        assertThat(session.getDeviceId()).isEqualTo("device-1");
        assertThat(session.getIpAddress()).isEqualTo("203.0.113.10");
        assertThat(session.getExpires()).isEqualTo(OffsetDateTime.now(clock).plusDays(30));

        assertThat(user.getLastLoginAt()).isEqualTo(OffsetDateTime.now(clock));
        assertThat(user.getLastLoginIp()).isEqualTo("203.0.113.10");
        verify(userSessionRepository).revokeExpiredSessions(eq(user.getId()), any(OffsetDateTime.class), eq("EXPIRED"));
    }

    @Test
    @DisplayName("unknown email fails the same way as a wrong password")
    void unknownEmailIsIndistinguishableFromBadPassword() {
        when(userRepository.findByEmailIgnoreCase("nobody@example.com")).thenReturn(Optional.empty());

        ResponseStatusException unknown = assertThrows(ResponseStatusException.class,
                () -> authService.login(new LoginRequest("nobody@example.com", PASSWORD, null), CLIENT));
        ResponseStatusException badPassword = assertThrows(ResponseStatusException.class,
                () -> authService.login(new LoginRequest("alice@example.com", "Wrong!Pass1", null), CLIENT));

        assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(unknown.getReason()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(badPassword.getStatusCode()).isEqualTo(unknown.getStatusCode());
        assertThat(badPassword.getReason()).isEqualTo(unknown.getReason());
    }

    @Test
    @DisplayName("five failed attempts lock the account for fifteen minutes")
    void repeatedFailuresLockAccount() {
        for (int attempt = 1; attempt <= 5; attempt++) {
            ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                    () -> authService.login(new LoginRequest("alice@example.com", "Wrong!Pass1", null), CLIENT));
            assertThat(exception.getReason()).isEqualTo("INVALID_CREDENTIALS");
        }

        assertThat(user.getFailedLoginAttempts()).isEqualTo(5);
        assertThat(user.getAccountLockedUntil()).isEqualTo(OffsetDateTime.now(clock).plusMinutes(15));

        ArgumentCaptor<AuditLogCommand> audits = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService, times(6)).recordQuietly(audits.capture());
        assertThat(audits.getAllValues())
                .extracting(AuditLogCommand::action)
                .containsOnly(AuditAction.LOGIN_FAILED, AuditAction.ACCOUNT_LOCKED);
        assertThat(audits.getAllValues().stream().filter(command -> command.action() == AuditAction.ACCOUNT_LOCKED))
                .hasSize(1);

        RetryableProblemException locked = assertThrows(RetryableProblemException.class,
                () -> authService.login(new LoginRequest("alice@example.com", PASSWORD, null), CLIENT));
        assertThat(locked.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
        assertThat(locked.getReason()).isEqualTo("ACCOUNT_LOCKED");
        assertThat(locked.getRetryAfterSeconds()).isEqualTo(900L);
        verify(userSessionRepository, never()).save(any(UserSession.class));
    }

    @Test
    @DisplayName("suspended account cannot log in with a correct password")
    void suspendedAccountCannotLogin() {
        user.setStatus(AccountStatus.SUSPENDED);

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.login(new LoginRequest("alice@example.com", PASSWORD, null), CLIENT));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(exception.getReason()).isEqualTo("ACCOUNT_SUSPENDED");
        verify(userSessionRepository, never()).save(any(UserSession.class));
    }

    @Test
    @DisplayName("refresh token is single use and rotated")
    void refreshRotatesToken() {
        UserSession session = activeSession("refresh-token", "device-1");

        LoginResponse response = authService.refresh(new RefreshRequest("refresh-token", "device-1"), CLIENT);

        assertThat(session.isRevoked()).isTrue();
        assertThat(session.getRevokedReason()).isEqualTo("ROTATED");
        assertThat(response.tokens().refreshToken()).isNotEqualTo("refresh-token");

        ArgumentCaptor<UserSession> captor = ArgumentCaptor.forClass(UserSession.class);
        verify(userSessionRepository).save(captor.capture());
        assertThat(captor.getValue().getSessionTokenHash()).isEqualTo(SecureTokens.sha256Hex(response.tokens().refreshToken()));
        assertThat(captor.getValue().getDeviceId()).isEqualTo("device-1");
    }

    @Test
    @DisplayName("refresh from another device revokes the session")
    void refreshFromAnotherDeviceRevokesSession() {
        UserSession session = activeSession("refresh-token", "device-1");

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("refresh-token", "device-2"), CLIENT));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exception.getReason()).isEqualTo("REFRESH_TOKEN_DEVICE_MISMATCH");
        assertThat(session.getRevokedReason()).isEqualTo("DEVICE_MISMATCH");
        verify(userSessionRepository, never()).save(any(UserSession.class));
    }

    @Test
    @DisplayName("refresh without a device id is treated as a device mismatch")
    void refreshWithoutDeviceIdRevokesSession() {
        UserSession session = activeSession("refresh-token", "device-1");

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("refresh-token", null), CLIENT));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exception.getReason()).isEqualTo("REFRESH_TOKEN_DEVICE_MISMATCH");
        assertThat(session.getRevokedReason()).isEqualTo("DEVICE_MISMATCH");
        verify(userSessionRepository, never()).save(any(UserSession.class));
    }

    @Test
    @DisplayName("refresh for a suspended user revokes the session")
    void refreshForInactiveUserRevokesSession() {
        UserSession session = activeSession("refresh-token", "device-1");
        user.setStatus(AccountStatus.SUSPENDED);

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("refresh-token", "device-1"), CLIENT));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(exception.getReason()).isEqualTo("USER_INACTIVE");
        assertThat(session.getRevokedReason()).isEqualTo("USER_INACTIVE");
        verify(userSessionRepository, never()).save(any(UserSession.class));
    }

    @Test
    @DisplayName("expired refresh token is rejected")
    void expiredRefreshTokenIsRejected() {
        UserSession session = activeSession("refresh-token", "device-1");
        session.setExpires(OffsetDateTime.now(clock).minusSeconds(1));

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("refresh-token", "device-1"), CLIENT));

        assertThat(exception.getReason()).isEqualTo("REFRESH_TOKEN_EXPIRED");
        assertThat(session.getRevokedReason()).isEqualTo("EXPIRED");
    }

    @Test
    @DisplayName("revoked refresh token cannot be reused")
    void revokedRefreshTokenIsRejected() {
        UserSession session = activeSession("refresh-token", "device-1");
        session.revoke(OffsetDateTime.now(clock).minusMinutes(1), "LOGOUT");

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("refresh-token", "device-1"), CLIENT));

        assertThat(exception.getReason()).isEqualTo("INVALID_REFRESH_TOKEN");
    }

    @Test
    @DisplayName("logout revokes the session and ignores unknown tokens")
    void logoutRevokesSessionAndIgnoresUnknownToken() {
        UserSession session = activeSession("refresh-token", "device-1");
        when(userSessionRepository.findBySessionTokenHash(SecureTokens.sha256Hex("unknown"))).thenReturn(Optional.empty());

        authService.logout(new LogoutRequest("refresh-token"), CLIENT);
        authService.logout(new LogoutRequest("unknown"), CLIENT);

        assertThat(session.getRevokedReason()).isEqualTo("LOGOUT");
        verify(auditLogService, times(1)).record(any(AuditLogCommand.class));
    }

    private UserSession activeSession(String rawToken, String deviceId) {
        UserSession session = new UserSession();
        session.setUser(user);
        session.setSessionTokenHash(SecureTokens.sha256Hex(rawToken));
        session.setIssuedAt(OffsetDateTime.now(clock).minusDays(1));
        session.setExpires(OffsetDateTime.now(clock).plusDays(1));
        session.setDeviceId(deviceId);
        when(userSessionRepository.findBySessionTokenHash(SecureTokens.sha256Hex(rawToken))).thenReturn(Optional.of(session));
        return session;
    }
}
