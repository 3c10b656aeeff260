package com.carelink.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.carelink.backend.global.mail.MailNotifier;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.auth.application.PasswordResetService;
import com.carelink.backend.modules.auth.application.SecureTokens;
import com.carelink.backend.modules.profile.application.ProfileService;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.infrastructure.persistence.UserSessionRepository;
import com.carelink.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class PasswordResetServiceTest {

    private static final String DEFAULT_PASSWORD = "WelcomeRemonta";
    private static final String NEW_PASSWORD = "N3w!Password";

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserSessionRepository userSessionRepository;

    @Mock
    private MailNotifier mailNotifier;

    @Mock
    private ProfileService profileService;

    @Mock
    private AuditLogService auditLogService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private Clock clock;
    private PasswordResetService passwordResetService;
    private User user;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        passwordResetService = new PasswordResetService(
                userRepository,
                userSessionRepository,
                passwordEncoder,
                mailNotifier,
                profileService,
                auditLogService,
                clock,
                DEFAULT_PASSWORD
        );

        user = TestEntities.withId(new User(), UUID.fromString("00000000-0000-0000-0000-000000000701"));
        user.setEmail("worker@example.com");
        user.setPasswordHash(passwordEncoder.encode("Old!Passw0rd"));
        user.setRole(UserRole.WORKER);
        user.setStatus(AccountStatus.ACTIVE);
        lenient().when(userRepository.findByEmailIgnoreCase("worker@example.com")).thenReturn(Optional.of(user));
    }

    @Test
    void requestResetMailsRawTokenAndStoresDigest() {
        when(profileService.findFirstName(user)).thenReturn("Wendy");
        when(mailNotifier.sendPasswordResetLink(eq("worker@example.com"), eq("Wendy"), anyString())).thenReturn(true);

        passwordResetService.requestReset(" Worker@Example.com", ClientRequestInfo.UNKNOWN);

        ArgumentCaptor<String> token = ArgumentCaptor.forClass(String.class);
        verify(mailNotifier).sendPasswordResetLink(eq("worker@example.com"), eq("Wendy"), token.capture());
        assertThat(user.getResetPasswordToken()).isEqualTo(SecureTokens.sha256Hex(token.getValue()));
        assertThat(user.getResetPasswordExpires()).isEqualTo(OffsetDateTime.now(clock).plusHours(1));

        ArgumentCaptor<AuditLogCommand> audit = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(audit.capture());
        assertThat(audit.getValue().metadata()).containsEntry("emailDelivered", true);
    }

    @Test
    void requestResetForUnknownAddressDoesNothing() {
        when(userRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        passwordResetService.requestReset("ghost@example.com", ClientRequestInfo.UNKNOWN);

        verifyNoInteractions(mailNotifier, auditLogService);
    }

    @Test
    void resetPasswordConsumesTokenAndSignsOutEverywhere() {
        user.assignResetPasswordToken(SecureTokens.sha256Hex("raw-token"), OffsetDateTime.now(clock).plusMinutes(30));
        when(userRepository.findByValidResetToken(SecureTokens.sha256Hex("raw-token"), OffsetDateTime.now(clock)))
                .thenReturn(Optional.of(user));

        passwordResetService.resetPassword("raw-token", NEW_PASSWORD, ClientRequestInfo.UNKNOWN);

        assertThat(passwordEncoder.matches(NEW_PASSWORD, user.getPasswordHash())).isTrue();
        assertThat(user.getResetPasswordToken()).isNull();
        verify(userSessionRepository).revokeAllForUser(user.getId(), OffsetDateTime.now(clock), "PASSWORD_RESET");
    }

    @Test
    void invalidOrExpiredTokenIsRejected() {
        when(userRepository.findByValidResetToken(any(), any())).thenReturn(Optional.empty());

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> passwordResetService.resetPassword("stale", NEW_PASSWORD, ClientRequestInfo.UNKNOWN));

        assertThat(exception.getReason()).isEqualTo("INVALID_RESET_TOKEN");
        verify(userSessionRepository, never()).revokeAllForUser(any(), any(), any());
    }

    @Test
    void weakNewPasswordIsRejectedBeforeTokenLookup() {
        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> passwordResetService.resetPassword("raw-token", "weak", ClientRequestInfo.UNKNOWN));

        assertThat(exception.getReason()).isEqualTo("WEAK_PASSWORD");
        verify(userRepository, never()).findByValidResetToken(any(), any());
    }

    @Test
    void setupPasswordReplacesSharedDefault() {
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));

        passwordResetService.setupPassword("worker@example.com", NEW_PASSWORD, ClientRequestInfo.UNKNOWN);

        assertThat(passwordEncoder.matches(NEW_PASSWORD, user.getPasswordHash())).isTrue();
    }

    @Test
    void setupPasswordClearsStaleFailedAttempts() {
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        OffsetDateTime twoHoursAgo = OffsetDateTime.now(clock).minusHours(2);
        user.registerFailedLogin(twoHoursAgo, 2, Duration.ofMinutes(15));
        user.registerFailedLogin(twoHoursAgo, 2, Duration.ofMinutes(15));

        passwordResetService.setupPassword("worker@example.com", NEW_PASSWORD, ClientRequestInfo.UNKNOWN);

        assertThat(user.getFailedLoginAttempts()).isZero();
        assertThat(user.getAccountLockedUntil()).isNull();
        verify(userRepository).save(user);
    }

    @Test
    void setupPasswordRefusedOnceAPersonalPasswordExists() {
        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> passwordResetService.setupPassword("worker@example.com", NEW_PASSWORD, ClientRequestInfo.UNKNOWN));

        assertThat(exception.getReason()).isEqualTo("PASSWORD_SETUP_NOT_ALLOWED");
    }

    @Test
    void setupPasswordRefusedForNonWorkers() {
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setRole(UserRole.CLIENT);

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> passwordResetService.setupPassword("worker@example.com", NEW_PASSWORD, ClientRequestInfo.UNKNOWN));

        assertThat(exception.getReason()).isEqualTo("PASSWORD_SETUP_NOT_ALLOWED");
    }
}
