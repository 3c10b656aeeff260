package com.carelink.backend.modules.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.carelink.backend.modules.user.domain.PasswordPolicy;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

class PasswordPolicyTest {

    @Test
    void acceptsPasswordMeetingEveryRule() {
        assertThat(PasswordPolicy.violations("Str0ng!Pass")).isEmpty();
        assertThat(PasswordPolicy.isStrong("Str0ng!Pass")).isTrue();
    }

    @Test
    void reportsEachMissingCharacterClass() {
        assertThat(PasswordPolicy.violations("alllowercase"))
                .containsExactly(
                        "Password must contain at least one uppercase letter",
                        "Password must contain at least one number",
                        "Password must contain at least one special character");
    }

    @Test
    void shortPasswordIsRejected() {
        assertThat(PasswordPolicy.violations("Ab1!")).containsExactly("Password must be at least 8 characters long");
        assertThat(PasswordPolicy.violations(null)).hasSize(1);
    }

    @Test
    void requireStrongRaisesWeakPassword() {
        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> PasswordPolicy.requireStrong("password"));

        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(exception.getReason()).isEqualTo("WEAK_PASSWORD");
    }
}
