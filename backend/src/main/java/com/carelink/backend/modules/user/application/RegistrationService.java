package com.carelink.backend.modules.user.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.auth.application.EmailVerificationService;
import com.carelink.backend.modules.profile.domain.ClientProfile;
import com.carelink.backend.modules.profile.domain.CoordinatorProfile;
import com.carelink.backend.modules.profile.domain.VerificationStatus;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.ClientProfileRepository;
import com.carelink.backend.modules.profile.infrastructure.persistence.CoordinatorProfileRepository;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.user.domain.AccountStatus;
import com.carelink.backend.modules.user.domain.MobileNumbers;
import com.carelink.backend.modules.user.domain.PasswordPolicy;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.modules.user.infrastructure.persistence.UserRepository;
import com.carelink.backend.modules.user.presentation.dto.RegisterClientRequest;
import com.carelink.backend.modules.user.presentation.dto.RegisterCoordinatorRequest;
import com.carelink.backend.modules.user.presentation.dto.RegisterWorkerRequest;
import com.carelink.backend.modules.user.presentation.dto.RegistrationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates a login together with the profile of the chosen role.
 */
@Service
@Transactional
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final UserRepository userRepository;
    private final WorkerProfileRepository workerProfileRepository;
    private final ClientProfileRepository clientProfileRepository;
    private final CoordinatorProfileRepository coordinatorProfileRepository;
    private final PasswordEncoder passwordEncoder;
    private final EmailVerificationService emailVerificationService;
    private final AuditLogService auditLogService;

    public RegistrationService(
            UserRepository userRepository,
            WorkerProfileRepository workerProfileRepository,
            ClientProfileRepository clientProfileRepository,
            CoordinatorProfileRepository coordinatorProfileRepository,
            PasswordEncoder passwordEncoder,
            EmailVerificationService emailVerificationService,
            AuditLogService auditLogService
    ) {
        this.userRepository = userRepository;
        this.workerProfileRepository = workerProfileRepository;
        this.clientProfileRepository = clientProfileRepository;
        this.coordinatorProfileRepository = coordinatorProfileRepository;
        this.passwordEncoder = passwordEncoder;
        this.emailVerificationService = emailVerificationService;
        this.auditLogService = auditLogService;
    }

    public RegistrationResponse registerWorker(RegisterWorkerRequest request, ClientRequestInfo client) {
        String mobile = requireMobile(request.mobile());
        User user = createUser(request.email(), request.password(), UserRole.WORKER);

        WorkerProfile profile = new WorkerProfile();
        profile.setUser(user);
        profile.setFirstName(request.firstName().trim());
        profile.setLastName(request.lastName().trim());
        profile.setMobile(mobile);
        profile.setLocation(trimToNull(request.location()));
        profile.setLanguages(cleanList(request.languages()));
        profile.setServices(cleanList(request.services()));
        profile.setSupportWorkerCategories(cleanList(request.supportWorkerCategories()));
        profile.setExperience(trimToNull(request.experience()));
        profile.setIntroduction(trimToNull(request.introduction()));
        profile.setHasVehicle(request.hasVehicle());
        profile.setPhotos(cleanList(request.photos()));
        profile.setConsentProfileShare(Boolean.TRUE.equals(request.consentProfileShare()));
        profile.setConsentMarketing(Boolean.TRUE.equals(request.consentMarketing()));
        profile.setProfileCompleted(true);
        profile.setPublished(false);
        profile.setVerificationStatus(VerificationStatus.NOT_STARTED);
        workerProfileRepository.save(profile);

        return complete(user, "worker", client);
    }

    public RegistrationResponse registerClient(RegisterClientRequest request, ClientRequestInfo client) {
        String mobile = requireMobile(request.mobile());
        User user = createUser(request.email(), request.password(), UserRole.CLIENT);

        ClientProfile profile = new ClientProfile();
        profile.setUser(user);
        profile.setFirstName(request.firstName().trim());
        profile.setLastName(request.lastName().trim());
        profile.setMobile(mobile);
        profile.setLocation(trimToNull(request.location()));
        clientProfileRepository.save(profile);

        return complete(user, "client", client);
    }

    public RegistrationResponse registerCoordinator(RegisterCoordinatorRequest request, ClientRequestInfo client) {
        String mobile = requireMobile(request.mobile());
        User user = createUser(request.email(), request.password(), UserRole.COORDINATOR);

        CoordinatorProfile profile = new CoordinatorProfile();
        profile.setUser(user);
        profile.setFirstName(request.firstName().trim());
        profile.setLastName(request.lastName().trim());
        profile.setMobile(mobile);
        profile.setOrganization(trimToNull(request.organization()));
        profile.setLocation(trimToNull(request.location()));
        coordinatorProfileRepository.save(profile);

        return complete(user, "coordinator", client);
    }

    private User createUser(String rawEmail, String password, UserRole role) {
        String email = normalizeEmail(rawEmail);
        PasswordPolicy.requireStrong(password);
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw emailTaken();
        }

        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setRole(role);
        user.setStatus(AccountStatus.ACTIVE);
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // concurrent registration with the same address
            throw emailTaken();
        }
    }

    private RegistrationResponse complete(User user, String registrationType, ClientRequestInfo client) {
        auditLogService.record(AuditLogCommand.of(AuditAction.REGISTRATION, user.getId(), client,
                Map.of("registrationType", registrationType)));
        emailVerificationService.sendVerification(user);
        log.info("Registered {} account {}", registrationType, user.getId());
        return new RegistrationResponse(user.getId(), user.getEmail(), user.getRole().name(), user.getStatus().name());
    }

    static String requireMobile(String raw) {
        return MobileNumbers.normalize(raw)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_MOBILE",
                        "Mobile must be an Australian mobile number (04xxxxxxxx or +614xxxxxxxx)"));
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    static ProblemException emailTaken() {
        return ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static List<String> cleanList(List<String> values) {
        List<String> cleaned = new ArrayList<>();
        if (values == null) {
            return cleaned;
        }
        values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .forEach(cleaned::add);
        return cleaned;
    }
}
