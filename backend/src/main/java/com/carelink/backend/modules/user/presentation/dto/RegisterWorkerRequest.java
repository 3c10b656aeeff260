package com.carelink.backend.modules.user.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterWorkerRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") String password,
        @NotBlank(message = "firstName is required") @Size(max = 100) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 100) String lastName,
        @NotBlank(message = "mobile is required") String mobile,
        @Size(max = 255) String location,
        List<String> languages,
        List<String> services,
        List<String> supportWorkerCategories,
        String experience,
        String introduction,
        Boolean hasVehicle,
        List<String> photos,
        Boolean consentProfileShare,
        Boolean consentMarketing
) {
}
