package com.carelink.backend.modules.user;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.carelink.backend.global.error.RestExceptionHandler;
import com.carelink.backend.modules.user.application.RegistrationService;
import com.carelink.backend.modules.user.presentation.RegistrationController;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

@ExtendWith(MockitoExtension.class)
class RegistrationControllerTest {

    @Mock
    private RegistrationService registrationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        LocalValidatorFactoryBean validator = new LocalValidatorFactoryBean();
        validator.afterPropertiesSet();
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RegistrationController(registrationService))
                .setControllerAdvice(new RestExceptionHandler())
                .setValidator(validator)
                .build();
    }

    @Test
    void oversizedClientLocationIsRejectedBeforeSaving() throws Exception {
        mockMvc.perform(
                        post("/auth/register/client")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body("\"location\": \"" + "s".repeat(256) + "\""))
                )
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.detail", containsString("location")));

        verify(registrationService, never()).registerClient(any(), any());
    }

    @Test
    void oversizedCoordinatorOrganizationIsRejectedBeforeSaving() throws Exception {
        mockMvc.perform(
                        post("/auth/register/coordinator")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body("\"organization\": \"" + "o".repeat(256) + "\""))
                )
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail", containsString("organization")));

        verify(registrationService, never()).registerCoordinator(any(), any());
    }

    @Test
    void oversizedWorkerLocationIsRejectedBeforeSaving() throws Exception {
        mockMvc.perform(
                        post("/auth/register/worker")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(body("\"location\": \"" + "w".repeat(256) + "\""))
                )
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail", containsString("location")));

        verify(registrationService, never()).registerWorker(any(), any());
    }

    private static String body(String extraField) {
        return """
                {
                  "email": "new.user@example.com",
                  "password": "Str0ng!Pass",
                  "firstName": "Nia",
                  "lastName": "User",
                  "mobile": "0412000111",
                  %s
                }
                """.formatted(extraField);
    }
}
