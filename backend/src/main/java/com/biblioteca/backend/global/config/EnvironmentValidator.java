package com.biblioteca.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Validates required settings once the application is ready and aborts startup when any is missing.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "dev-only-biblioteca-jwt-secret-change-me-2025";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_EXPIRATION_MILLIS = 604_800_000L;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(DEFAULT_DEV_SECRET::equals)
                .ifPresent(secret -> log.warn("jwt.secret uses the development default; set JWT_SECRET in production"));
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "server.port"
        };

        for (String var : requiredVars) {
            String value = environment.getProperty(var);
            if (value == null || value.trim().isEmpty()) {
                problems.add(var + ": missing");
            }
        }

        String jwtSecret = environment.getProperty("jwt.secret");
        if (jwtSecret != null && !jwtSecret.isBlank() && secretLength(jwtSecret) < MIN_SECRET_BYTES) {
            problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }

        String jwtExpiration = environment.getProperty("jwt.expiration");
        if (jwtExpiration != null && !jwtExpiration.isBlank()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.trim());
                if (expiration < MIN_EXPIRATION_MILLIS || expiration > MAX_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration: must be between " + MIN_EXPIRATION_MILLIS
                            + " and " + MAX_EXPIRATION_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number");
            }
        }

        return problems;
    }

    private int secretLength(String secret) {
        try {
            return Base64.getDecoder().decode(secret).length;
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8).length;
        }
    }
}
