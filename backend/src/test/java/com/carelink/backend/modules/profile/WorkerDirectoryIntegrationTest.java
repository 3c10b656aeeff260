package com.carelink.backend.modules.profile;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.UUID;

import com.carelink.backend.modules.profile.domain.VerificationStatus;
import com.carelink.backend.modules.profile.domain.WorkerProfile;
import com.carelink.backend.modules.profile.infrastructure.persistence.WorkerProfileRepository;
import com.carelink.backend.modules.user.domain.User;
import com.carelink.backend.modules.user.domain.UserRole;
import com.carelink.backend.support.AbstractPostgresIntegrationTest;
import com.carelink.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class WorkerDirectoryIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Str0ng!Pass";
    private static final String ADMIN_EMAIL = "admin@example.com";
    private static final String CLIENT_EMAIL = "client@example.com";
    private static final String LISTED_WORKER_EMAIL = "listed@example.com";
    private static final String HIDDEN_WORKER_EMAIL = "hidden@example.com";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WorkerProfileRepository workerProfileRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    private UUID listedProfileId;
    private UUID hiddenProfileId;

    @BeforeEach
    void setUp() {
        testUserFactory.ensureAdmin(ADMIN_EMAIL, PASSWORD);
        testUserFactory.ensureUser(CLIENT_EMAIL, PASSWORD, UserRole.CLIENT);

        listedProfileId = prepareWorker(LISTED_WORKER_EMAIL, VerificationStatus.APPROVED, true);
        hiddenProfileId = prepareWorker(HIDDEN_WORKER_EMAIL, VerificationStatus.PENDING_REVIEW, false);
    }

    @Test
    void clientFindsOnlyPublishedApprovedWorkers() throws Exception {
        String clientToken = accessToken(CLIENT_EMAIL);

        mockMvc.perform(get("/workers/search").header("Authorization", "Bearer " + clientToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.items[0].profileId").value(listedProfileId.toString()))
                .andExpect(jsonPath("$.items[0].services[0]").value("Personal Care"))
                .andExpect(jsonPath("$.items[0].mobile").doesNotExist());

        mockMvc.perform(
                        get("/workers/search")
                                .header("Authorization", "Bearer " + clientToken)
                                .param("location", "parra")
                                .param("services", "Community Access", "Personal Care")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1));

        mockMvc.perform(
                        get("/workers/search")
                                .header("Authorization", "Bearer " + clientToken)
                                .param("services", "Transport")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));

        mockMvc.perform(
                        get("/workers/search")
                                .header("Authorization", "Bearer " + clientToken)
                                .param("search", "%")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));
    }

    @Test
    void adminPublishToggleControlsDirectoryListing() throws Exception {
        String adminToken = accessToken(ADMIN_EMAIL);
        String clientToken = accessToken(CLIENT_EMAIL);

        mockMvc.perform(
                        patch("/admin/verification/workers/{profileId}/publish", listedProfileId)
                                .header("Authorization", "Bearer " + adminToken)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"isPublished\": false}")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.published").value(false));

        mockMvc.perform(get("/workers/search").header("Authorization", "Bearer " + clientToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));

        mockMvc.perform(
                        patch("/admin/verification/workers/{profileId}/publish", hiddenProfileId)
                                .header("Authorization", "Bearer " + adminToken)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"isPublished\": true}")
                )
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("WORKER_NOT_APPROVED"));

        mockMvc.perform(
                        patch("/admin/verification/workers/{profileId}/publish", listedProfileId)
                                .header("Authorization", "Bearer " + adminToken)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{}")
                )
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void workersCannotBrowseTheDirectory() throws Exception {
        mockMvc.perform(get("/workers/search").header("Authorization", "Bearer " + accessToken(LISTED_WORKER_EMAIL)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_ROLE"));
        mockMvc.perform(get("/workers/search"))
                .andExpect(status().isUnauthorized());
    }

    private UUID prepareWorker(String email, VerificationStatus status, boolean published) {
        User worker = testUserFactory.ensureWorker(email, PASSWORD);
        WorkerProfile profile = workerProfileRepository.findByUserId(worker.getId()).orElseThrow();
        profile.setCity("Parramatta");
        profile.setState("NSW");
        profile.setServices(List.of("Personal Care", "Domestic Assistance"));
        profile.setVerificationStatus(status);
        profile.setPublished(published);
        return workerProfileRepository.save(profile).getId();
    }

    private String accessToken(String email) throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/auth/login")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "email": "%s",
                                          "password": "%s",
                                          "deviceId": "directory-test"
                                        }
                                        """.formatted(email, PASSWORD))
                )
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("tokens").path("accessToken").asText();
    }
}
