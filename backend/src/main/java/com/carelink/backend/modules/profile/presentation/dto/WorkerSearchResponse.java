package com.carelink.backend.modules.profile.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.WorkerProfile;

public record WorkerSearchResponse(
        List<Worker> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {

    /**
     * Public card of a listed worker. Contact details and compliance data are not exposed.
     */
    public record Worker(
            UUID profileId,
            String firstName,
            String lastName,
            String photo,
            String introduction,
            String experience,
            String location,
            String city,
            String state,
            List<String> services,
            List<String> supportWorkerCategories,
            List<String> languages,
            Boolean hasVehicle
    ) {

        public static Worker from(WorkerProfile profile) {
            List<String> photos = profile.getPhotos();
            return new Worker(
                    profile.getId(),
                    profile.getFirstName(),
                    profile.getLastName(),
                    photos == null || photos.isEmpty() ? null : photos.get(0),
                    profile.getIntroduction(),
                    profile.getExperience(),
                    profile.getLocation(),
                    profile.getCity(),
                    profile.getState(),
                    copy(profile.getServices()),
                    copy(profile.getSupportWorkerCategories()),
                    copy(profile.getLanguages()),
                    profile.getHasVehicle()
            );
        }

        private static List<String> copy(List<String> values) {
            return values == null ? List.of() : List.copyOf(values);
        }
    }
}
