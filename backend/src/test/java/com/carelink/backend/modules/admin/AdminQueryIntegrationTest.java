package com.carelink.backend.modules.admin;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

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
class AdminQueryIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String PASSWORD = "Str0ng!Pass";
    private static final String ADMIN_EMAIL = "admin@example.com";
    private static final String CLIENT_EMAIL = "client@example.com";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    private User client;
    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        testUserFactory.ensureAdmin(ADMIN_EMAIL, PASSWORD);
        client = testUserFactory.ensureUser(CLIENT_EMAIL, PASSWORD, UserRole.CLIENT);
        accessToken(CLIENT_EMAIL);
        adminToken = accessToken(ADMIN_EMAIL);
    }

    @Test
    void auditLogListsWithAndWithoutFilters() throws Exception {
        mockMvc.perform(get("/admin/audit-logs").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements", greaterThanOrEqualTo(2)));

        mockMvc.perform(
                        get("/admin/audit-logs")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("userId", client.getId().toString())
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.items[0].userEmail").value(CLIENT_EMAIL))
                .andExpect(jsonPath("$.items[0].action").value("LOGIN_SUCCESS"));

        mockMvc.perform(
                        get("/admin/audit-logs")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("action", "login_success")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[*].action", everyItem(is("LOGIN_SUCCESS"))));

        mockMvc.perform(
                        get("/admin/audit-logs")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("userId", client.getId().toString())
                                .param("action", "PASSWORD_CHANGE")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));

        mockMvc.perform(
                        get("/admin/audit-logs")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("action", "teleport")
                )
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_AUDIT_ACTION"));
    }

    @Test
    void userListingWithAndWithoutFilters() throws Exception {
        mockMvc.perform(get("/admin/users").header("Authorization", "Bearer " + adminToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements", greaterThanOrEqualTo(2)));

        mockMvc.perform(
                        get("/admin/users")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("role", "client")
                                .param("status", "active")
                                .param("search", "CLIENT@")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.items[0].email").value(CLIENT_EMAIL))
                .andExpect(jsonPath("$.items[0].passwordHash").doesNotExist());

        mockMvc.perform(
                        get("/admin/users")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("status", "suspended")
                )
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(0));

        mockMvc.perform(
                        get("/admin/users")
                                .header("Authorization", "Bearer " + adminToken)
                                .param("role", "nurse")
                )
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ROLE"));
    }

    private String accessToken(String email) throws Exception {
        MvcResult result = mockMvc.perform(
                        post("/auth/login")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("""
                                        {
                                          "email": "%s",
                                          "password": "%s",
                                          "deviceId": "admin-query-test"
                                        }
                                        """.formatted(email, PASSWORD))
                )
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("tokens").path("accessToken").asText();
    }
}
