package com.carelink.backend.modules.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.auth.application.EmailVerificationService;
import com.carelink.backend.modules.profile.domain.ClientProfile;
import com.carelink.backend.modules.profile.domain.VerificationStatus;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.ClientProfileRepository;
import com.carelink.backend.modules.profile.infrastructure.persistence.CoordinatorProfileRepository;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.user.application.RegistrationService;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.presentation.dto.RegisterClientRequest;
import com.carelink.backend.modules.user.presentation.dto.RegisterWorkerRequest;
import com.carelink.backend.modules.user.presentation.dto.RegistrationResponse;
import com.carelink.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceTest {

    private static final UUID NEW_USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000601");

    @Mock
    private UserRepository userRepository;

    @Mock
    private WorkerProfileRepository workerProfileRepository;

    @Mock
    private ClientProfileRepository clientProfileRepository;

    @Mock
    private CoordinatorProfileRepository coordinatorProfileRepository;

    @Mock
    private EmailVerificationService emailVerificationService;

    @Mock
    private AuditLogService auditLogService;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private RegistrationService registrationService;

    @BeforeEach
    void setUp() {
        registrationService = new RegistrationService(
                userRepository,
                workerProfileRepository,
                clientProfileRepository,
                coordinatorProfileRepository,
                passwordEncoder,
                emailVerificationService,
                auditLogService
        );
        lenient().when(userRepository.saveAndFlush(any(User.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.<User>getArgument(0), NEW_USER_ID));
    }

    @Test
    void registerWorkerCreatesUnpublishedProfile() {
        RegistrationResponse response = registrationService.registerWorker(workerRequest("New.Worker@Example.com ", "0412 345 678"),
                ClientRequestInfo.UNKNOWN);

        assertThat(response.userId()).isEqualTo(NEW_USER_ID);
        assertThat(response.email()).isEqualTo("new.worker@example.com");
        assertThat(response.role()).isEqualTo("WORKER");
        assertThat(response.status()).isEqualTo("ACTIVE");

        ArgumentCaptor<WorkerProfile> captor = ArgumentCaptor.forClass(WorkerProfile.class);
        verify(workerProfileRepository).save(captor.capture());
        WorkerProfile profile = captor.getValue();
        assertThat(profile.getMobile()).isEqualTo("0412345678");
        assertThat(profile.getLanguages()).containsExactly("English", "Mandarin");
        assertThat(profile.isPublished()).isFalse();
        assertThat(profile.isProfileCompleted()).isTrue();
        assertThat(profile.getVerificationStatus()).isEqualTo(VerificationStatus.NOT_STARTED);
        assertThat(profile.isConsentProfileShare()).isTrue();
        assertThat(profile.isConsentMarketing()).isFalse();

        ArgumentCaptor<User> userCaptor = ArgumentCaptor.forClass(User.class);
        verify(emailVerificationService).sendVerification(userCaptor.capture());
        assertThat(passwordEncoder.matches("Str0ng!Pass", userCaptor.getValue().getPasswordHash())).isTrue();
        verify(auditLogService).record(any());
    }

    @Test
    void registerClientCreatesClientProfile() {
        registrationService.registerClient(new RegisterClientRequest(
                "client@example.com", "Str0ng!Pass", "Carl", "Client", "+61412345678", " Sydney "), ClientRequestInfo.UNKNOWN);

        ArgumentCaptor<ClientProfile> captor = ArgumentCaptor.forClass(ClientProfile.class);
        verify(clientProfileRepository).save(captor.capture());
        assertThat(captor.getValue().getMobile()).isEqualTo("+61412345678");
        assertThat(captor.getValue().getLocation()).isEqualTo("Sydney");
    }

    @Test
    void duplicateEmailIsConflict() {
        when(userRepository.existsByEmailIgnoreCase("taken@example.com")).thenReturn(true);

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> registrationService.registerWorker(workerRequest("Taken@example.com", "0412345678"), ClientRequestInfo.UNKNOWN));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(exception.getReason()).isEqualTo("EMAIL_ALREADY_REGISTERED");
        verify(userRepository, never()).saveAndFlush(any(User.class));
        verifyNoInteractions(emailVerificationService);
    }

    @Test
    void concurrentDuplicateIsAlsoConflict() {
        doThrow(new DataIntegrityViolationException("uq_app_user_email")).when(userRepository).saveAndFlush(any(User.class));

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> registrationService.registerWorker(workerRequest("race@example.com", "0412345678"), ClientRequestInfo.UNKNOWN));

        assertThat(exception.getReason()).isEqualTo("EMAIL_ALREADY_REGISTERED");
    }

    @Test
    void weakPasswordIsRejectedBeforeAnyWrite() {
        RegisterClientRequest request = new RegisterClientRequest(
                "client@example.com", "password", "Carl", "Client", "0412345678", null);

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> registrationService.registerClient(request, ClientRequestInfo.UNKNOWN));

        assertThat(exception.getReason()).isEqualTo("WEAK_PASSWORD");
        verifyNoInteractions(clientProfileRepository);
    }

    @Test
    void invalidMobileIsRejected() {
        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> registrationService.registerWorker(workerRequest("worker@example.com", "02 9999 9999"), ClientRequestInfo.UNKNOWN));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(exception.getReason()).isEqualTo("INVALID_MOBILE");
        verify(userRepository, never()).saveAndFlush(any(User.class));
    }

    private static RegisterWorkerRequest workerRequest(String email, String mobile) {
        return new RegisterWorkerRequest(
                email,
                "Str0ng!Pass",
                "Wendy",
                "Walker",
                mobile,
                "Parramatta NSW",
                Arrays.asList("English", " Mandarin ", "English", null, ""),
                List.of("Personal Care"),
                List.of("Disability Support"),
                "5 years",
                "Friendly and reliable",
                true,
                List.of(),
                true,
                null
        );
    }
}
