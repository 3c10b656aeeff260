package com.carelink.backend.modules.user.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.carelink.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Strength rules applied to every password a user chooses.
 */
public final class PasswordPolicy {

    public static final int MIN_LENGTH = 8;

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern SPECIAL = Pattern.compile("[@!#$%^&*(),.?\":{}|<>]");

    private PasswordPolicy() {
    }

    /**
     * @return human readable violations, empty when the password is acceptable
     */
    public static List<String> violations(String password) {
        List<String> problems = new ArrayList<>();
        if (password == null || password.length() < MIN_LENGTH) {
            problems.add("Password must be at least " + MIN_LENGTH + " characters long");
            if (password == null) {
                return problems;
            }
        }
        if (!UPPERCASE.matcher(password).find()) {
            problems.add("Password must contain at least one uppercase letter");
        }
        if (!LOWERCASE.matcher(password).find()) {
            problems.add("Password must contain at least one lowercase letter");
        }
        if (!DIGIT.matcher(password).find()) {
            problems.add("Password must contain at least one number");
        }
        if (!SPECIAL.matcher(password).find()) {
            problems.add("Password must contain at least one special character");
        }
        return problems;
    }

    public static boolean isStrong(String password) {
        return violations(password).isEmpty();
    }

    public static void requireStrong(String password) {
        List<String> problems = violations(password);
        if (!problems.isEmpty()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "WEAK_PASSWORD", String.join("; ", problems));
        }
    }
}
