package com.carelink.backend.modules.profile.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.carelink.backend.global.error.ProblemException;
import com.carelink.backend.global.web.ClientRequestInfo;
import com.carelink.backend.modules.audit.application.AuditLogService;
import com.carelink.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.carelink.backend.modules.audit.domain.AuditAction;
import com.carelink.backend.modules.profile.domain.ClientProfile;
import com.carelink.backend.modules.profile.domain.CoordinatorProfile;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.ClientProfileRepository;
import com.carelink.backend.modules.profile.infrastructure.persistence.CoordinatorProfileRepository;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.profile.presentation.dto.ClientProfileResponse;
import com.carelink.backend.modules.profile.presentation.dto.CoordinatorProfileResponse;
import com.carelink.backend.modules.profile.presentation.dto.UpdateWorkerProfileRequest;
import com.carelink.backend.modules.profile.presentation.dto.WorkerProfileResponse;
import com.carelink.backend.modules.user.domain.User;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProfileService {

    private static final Pattern ABN = Pattern.compile("^\\d{11}$");

    private final WorkerProfileRepository workerProfileRepository;
    private final ClientProfileRepository clientProfileRepository;
    private final CoordinatorProfileRepository coordinatorProfileRepository;
    private final AuditLogService auditLogService;

    public ProfileService(
            WorkerProfileRepository workerProfileRepository,
            ClientProfileRepository clientProfileRepository,
            CoordinatorProfileRepository coordinatorProfileRepository,
            AuditLogService auditLogService
    ) {
        this.workerProfileRepository = workerProfileRepository;
        this.clientProfileRepository = clientProfileRepository;
        this.coordinatorProfileRepository = coordinatorProfileRepository;
        this.auditLogService = auditLogService;
    }

    @Transactional(readOnly = true)
    public WorkerProfileResponse getWorkerProfile(UUID userId) {
        return WorkerProfileResponse.from(findWorkerProfile(userId));
    }

    @Transactional(readOnly = true)
    public ClientProfileResponse getClientProfile(UUID userId) {
        ClientProfile profile = clientProfileRepository.findByUserId(userId)
                .orElseThrow(() -> ProblemException.notFound("CLIENT_PROFILE_NOT_FOUND", "Client profile not found"));
        return new ClientProfileResponse(
                profile.getId(),
                profile.getUser().getId(),
                profile.getUser().getEmail(),
                profile.getFirstName(),
                profile.getLastName(),
                profile.getMobile(),
                profile.getLocation(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }

    @Transactional(readOnly = true)
    public CoordinatorProfileResponse getCoordinatorProfile(UUID userId) {
        CoordinatorProfile profile = coordinatorProfileRepository.findByUserId(userId)
                .orElseThrow(() -> ProblemException.notFound("COORDINATOR_PROFILE_NOT_FOUND", "Coordinator profile not found"));
        return new CoordinatorProfileResponse(
                profile.getId(),
                profile.getUser().getId(),
                profile.getUser().getEmail(),
                profile.getFirstName(),
                profile.getLastName(),
                profile.getMobile(),
                profile.getOrganization(),
                profile.getLocation(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }

    public WorkerProfileResponse updateWorkerProfile(UUID userId, UpdateWorkerProfileRequest request, ClientRequestInfo client) {
        WorkerProfile profile = findWorkerProfile(userId);

        if (request.abn() != null && !request.abn().isBlank()
                && !ABN.matcher(request.abn().replace(" ", "")).matches()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_ABN", "ABN must be 11 digits");
        }

        if (isBlankButPresent(request.firstName()) || isBlankButPresent(request.lastName())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "NAME_REQUIRED", "First and last name cannot be cleared");
        }

        List<String> changed = new ArrayList<>();
        applyText(request.firstName(), profile::setFirstName, "firstName", changed);
        applyText(request.lastName(), profile::setLastName, "lastName", changed);
        applyText(request.location(), profile::setLocation, "location", changed);
        applyText(request.city(), profile::setCity, "city", changed);
        applyText(request.state(), profile::setState, "state", changed);
        applyText(request.postalCode(), profile::setPostalCode, "postalCode", changed);
        apply(request.age(), profile::setAge, "age", changed);
        applyText(request.gender(), profile::setGender, "gender", changed);
        applyText(request.genderIdentity(), profile::setGenderIdentity, "genderIdentity", changed);
        apply(cleanList(request.languages()), profile::setLanguages, "languages", changed);
        apply(cleanList(request.services()), profile::setServices, "services", changed);
        apply(cleanList(request.supportWorkerCategories()), profile::setSupportWorkerCategories, "supportWorkerCategories", changed);
        applyText(request.experience(), profile::setExperience, "experience", changed);
        applyText(request.introduction(), profile::setIntroduction, "introduction", changed);
        applyText(request.qualifications(), profile::setQualifications, "qualifications", changed);
        apply(request.hasVehicle(), profile::setHasVehicle, "hasVehicle", changed);
        applyText(request.funFact(), profile::setFunFact, "funFact", changed);
        applyText(request.hobbies(), profile::setHobbies, "hobbies", changed);
        applyText(request.uniqueService(), profile::setUniqueService, "uniqueService", changed);
        applyText(request.whyEnjoyWork(), profile::setWhyEnjoyWork, "whyEnjoyWork", changed);
        applyText(request.additionalInfo(), profile::setAdditionalInfo, "additionalInfo", changed);
        applyText(request.abn() != null ? request.abn().replace(" ", "") : null, profile::setAbn, "abn", changed);
        apply(cleanList(request.photos()), profile::setPhotos, "photos", changed);
        apply(request.consentProfileShare(), profile::setConsentProfileShare, "consentProfileShare", changed);
        apply(request.consentMarketing(), profile::setConsentMarketing, "consentMarketing", changed);

        if (!changed.isEmpty()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("section", "worker_profile");
            metadata.put("fields", changed);
            auditLogService.record(AuditLogCommand.of(AuditAction.PROFILE_UPDATE, userId, client, metadata));
        }
        return WorkerProfileResponse.from(profile);
    }

    /**
     * Writes a normalized mobile number onto whichever profile the user has.
     */
    public void updateMobile(User user, String normalizedMobile) {
        switch (user.getRole()) {
            case WORKER -> findWorkerProfile(user.getId()).setMobile(normalizedMobile);
            case CLIENT -> clientProfileRepository.findByUserId(user.getId())
                    .orElseThrow(this::profileNotFound)
                    .setMobile(normalizedMobile);
            case COORDINATOR -> coordinatorProfileRepository.findByUserId(user.getId())
                    .orElseThrow(this::profileNotFound)
                    .setMobile(normalizedMobile);
            default -> throw profileNotFound();
        }
    }

    @Transactional(readOnly = true)
    public String resolveDisplayName(User user) {
        return findNames(user)
                .map(names -> (names[0] + " " + names[1]).trim())
                .orElseGet(() -> emailLocalPart(user.getEmail()));
    }

    @Transactional(readOnly = true)
    public String findFirstName(User user) {
        return findNames(user).map(names -> names[0]).orElse(null);
    }

    private Optional<String[]> findNames(User user) {
        if (user.getRole() == null) {
            return Optional.empty();
        }
        return switch (user.getRole()) {
            case WORKER -> workerProfileRepository.findByUserId(user.getId())
                    .map(p -> new String[]{p.getFirstName(), p.getLastName()});
            case CLIENT -> clientProfileRepository.findByUserId(user.getId())
                    .map(p -> new String[]{p.getFirstName(), p.getLastName()});
            case COORDINATOR -> coordinatorProfileRepository.findByUserId(user.getId())
                    .map(p -> new String[]{p.getFirstName(), p.getLastName()});
            case ADMIN -> Optional.empty();
        };
    }

    private WorkerProfile findWorkerProfile(UUID userId) {
        return workerProfileRepository.findByUserId(userId)
                .orElseThrow(() -> ProblemException.notFound("WORKER_PROFILE_NOT_FOUND", "Worker profile not found"));
    }

    private ProblemException profileNotFound() {
        return ProblemException.notFound("PROFILE_NOT_FOUND", "No profile exists for this account");
    }

    private static boolean isBlankButPresent(String value) {
        return value != null && value.isBlank();
    }

    private static void applyText(String value, Consumer<String> setter, String field, List<String> changed) {
        if (value != null) {
            String trimmed = value.trim();
            setter.accept(trimmed.isEmpty() ? null : trimmed);
            changed.add(field);
        }
    }

    private static <T> void apply(T value, Consumer<T> setter, String field, List<String> changed) {
        if (value != null) {
            setter.accept(value);
            changed.add(field);
        }
    }

    private static List<String> cleanList(List<String> values) {
        if (values == null) {
            return null;
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static String emailLocalPart(String email) {
        if (email == null) {
            return null;
        }
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }
}
