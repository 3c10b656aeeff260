package com.carelink.backend.modules.profile.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Null fields are left untouched, list fields replace the stored list.
 */
public record UpdateWorkerProfileRequest(
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 255) String location,
        @Size(max = 100) String city,
        @Size(max = 50) String state,
        @Size(max = 10) String postalCode,
        @Min(16) @Max(120) Integer age,
        @Size(max = 32) String gender,
        @Size(max = 64) String genderIdentity,
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
        Boolean consentProfileShare,
        Boolean consentMarketing
) {
}
