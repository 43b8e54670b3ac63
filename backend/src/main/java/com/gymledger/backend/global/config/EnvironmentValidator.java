package com.gymledger.backend.global.config;

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
 * Validates required settings once the context is up and refuses to serve with
 * a broken configuration.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);
    private static final String PLACEHOLDER_SECRET = "dev-jwt-secret-change-me-before-deploying-gymledger";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "gymledger.membership.renewal-window-days"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + var);
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        boolean enforceStrongSecret = environment.getProperty(
                "gymledger.security.enforce-strong-secret", Boolean.class, false);
        if (jwtSecret.filter(PLACEHOLDER_SECRET::equals).isPresent()) {
            if (enforceStrongSecret) {
                problems.add("jwt.secret still uses the development placeholder");
            } else {
                log.warn("jwt.secret uses the development placeholder; set JWT_SECRET before deploying");
            }
        }

        validateLongRange("jwt.expiration", 300_000L, 86_400_000L, problems);
        validateLongRange("gymledger.membership.renewal-window-days", 0L, 90L, problems);

        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Environment validated");
    }

    private void validateLongRange(String key, long min, long max, List<String> problems) {
        String raw = environment.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min || value > max) {
                problems.add(key + " must be within " + min + ".." + max);
            }
        } catch (NumberFormatException e) {
            problems.add(key + " must be numeric");
        }
    }
}
