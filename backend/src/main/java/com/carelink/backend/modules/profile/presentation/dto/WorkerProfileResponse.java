package com.carelink.backend.modules.profile.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.WorkerProfile;

public record WorkerProfileResponse(
        UUID id,
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String mobile,
        String location,
        String city,
        String state,
        String postalCode,
        Integer age,
        String gender,
        List<String> languages,
        List<String> services,
        List<String> supportWorkerCategories,
        String experience,
        String introduction,
        String qualifications,
        Boolean hasVehicle,
        String funFact,
        String hobbies,
        String uniqueService,
        String whyEnjoyWork,
        String additionalInfo,
        String abn,
        List<String> photos,
        boolean consentProfileShare,
        boolean consentMarketing,
        boolean profileCompleted,
        boolean published,
        String verificationStatus,
        OffsetDateTime verificationSubmittedAt,
        OffsetDateTime verificationReviewedAt,
        String verificationNotes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static WorkerProfileResponse from(WorkerProfile profile) {
        return new WorkerProfileResponse(
                profile.getId(),
                profile.getUser().getId(),
                profile.getUser().getEmail(),
                profile.getFirstName(),
                profile.getLastName(),
                profile.getMobile(),
                profile.getLocation(),
                profile.getCity(),
                profile.getState(),
                profile.getPostalCode(),
                profile.getAge(),
                profile.getGender(),
                copy(profile.getLanguages()),
                copy(profile.getServices()),
                copy(profile.getSupportWorkerCategories()),
                profile.getExperience(),
                profile.getIntroduction(),
                profile.getQualifications(),
                profile.getHasVehicle(),
                profile.getFunFact(),
                profile.getHobbies(),
                profile.getUniqueService(),
                profile.getWhyEnjoyWork(),
                profile.getAdditionalInfo(),
                profile.getAbn(),
                copy(profile.getPhotos()),
                profile.isConsentProfileShare(),
                profile.isConsentMarketing(),
                profile.isProfileCompleted(),
                profile.isPublished(),
                profile.getVerificationStatus().name(),
                profile.getVerificationSubmittedAt(),
                profile.getVerificationReviewedAt(),
                profile.getVerificationNotes(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
