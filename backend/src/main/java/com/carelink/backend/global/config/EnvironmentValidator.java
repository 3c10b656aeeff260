package com.carelink.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required configuration once the context is up.
 * With {@code app.env-validation.fail-fast=true} a failed check aborts startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_JWT_SECRET = "dev-jwt-secret-change-me-carelink-local-only-0123456789";
    private static final long MIN_ACCESS_TTL_MILLIS = 300_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;
    private static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "app.frontend-base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (problems.isEmpty()) {
            log.info("Environment validation passed");
            return;
        }

        problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
        if (environment.getProperty("app.env-validation.fail-fast", Boolean.class, false)) {
            throw new IllegalStateException("Invalid environment configuration: " + String.join("; ", problems));
        }
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret")).ifPresent(secret -> {
            if (DEFAULT_JWT_SECRET.equals(secret)) {
                problems.add("jwt.secret still uses the development default");
            }
            if (secret.length() < MIN_SECRET_BYTES) {
                problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " characters");
            }
        });

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < MIN_ACCESS_TTL_MILLIS || expiration > MAX_ACCESS_TTL_MILLIS) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be numeric");
            }
        });

        return problems;
    }
}
