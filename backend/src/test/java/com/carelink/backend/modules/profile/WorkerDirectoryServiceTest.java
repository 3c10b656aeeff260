package com.carelink.backend.modules.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import com.carelink.backend.modules.profile.application.WorkerDirectoryService;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.profile.presentation.dto.WorkerSearchResponse;
import com.carelink.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class WorkerDirectoryServiceTest {

    private static final UUID PROFILE_ID = UUID.fromString("00000000-0000-0000-0000-000000000901");

    @Mock
    private WorkerProfileRepository workerProfileRepository;

    private WorkerDirectoryService directoryService;

    @BeforeEach
    void setUp() {
        directoryService = new WorkerDirectoryService(workerProfileRepository);
    }

    @Test
    void blankFiltersAreSentAsEmptyStrings() {
        when(workerProfileRepository.searchPublished(anyString(), anyString(), anyString(), any(Pageable.class)))
                .thenReturn(Page.empty());

        directoryService.search(null, "  ", null, 0, 0);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(workerProfileRepository).searchPublished(eq(""), eq(""), eq(""), pageable.capture());
        assertThat(pageable.getValue().getPageSize()).isEqualTo(20);
        assertThat(pageable.getValue().getPageNumber()).isZero();
    }

    @Test
    void wildcardsInSearchTextAreEscaped() {
        when(workerProfileRepository.searchPublished(anyString(), anyString(), anyString(), any(Pageable.class)))
                .thenReturn(Page.empty());

        directoryService.search(" 50%_off\\ ", "Parramatta", null, -3, 500);

        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(workerProfileRepository).searchPublished(
                eq("%50\\%\\_off\\\\%"), eq("%Parramatta%"), eq(""), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isZero();
        assertThat(pageable.getValue().getPageSize()).isEqualTo(50);
    }

    @Test
    void servicesAreTrimmedDeduplicatedAndJoined() {
        when(workerProfileRepository.searchPublished(anyString(), anyString(), anyString(), any(Pageable.class)))
                .thenReturn(Page.empty());

        directoryService.search(null, null,
                Arrays.asList(" Personal Care", "Personal Care", "", null, "Bad|Value", "Community Access"), 0, 10);

        verify(workerProfileRepository).searchPublished(
                eq(""), eq(""), eq("Personal Care|Community Access"), any(Pageable.class));
    }

    @Test
    void resultCardsExposeFirstPhotoOnly() {
        WorkerProfile profile = TestEntities.withId(new WorkerProfile(), PROFILE_ID);
        profile.setFirstName("Wendy");
        profile.setLastName("Walker");
        profile.setCity("Parramatta");
        profile.setServices(List.of("Personal Care"));
        profile.setPhotos(List.of("https://files.example/a.jpg", "https://files.example/b.jpg"));
        when(workerProfileRepository.searchPublished(anyString(), anyString(), anyString(), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of(profile), PageRequest.of(0, 20), 1));

        WorkerSearchResponse response = directoryService.search("wen", null, null, 0, 20);

        assertThat(response.totalElements()).isEqualTo(1);
        WorkerSearchResponse.Worker card = response.items().get(0);
        assertThat(card.profileId()).isEqualTo(PROFILE_ID);
        assertThat(card.photo()).isEqualTo("https://files.example/a.jpg");
        assertThat(card.services()).containsExactly("Personal Care");
        assertThat(card.languages()).isEmpty();
    }
}
