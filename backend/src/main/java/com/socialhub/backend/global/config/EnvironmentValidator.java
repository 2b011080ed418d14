package com.socialhub.backend.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
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
 * Fails startup when required settings are missing or unusable.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "social.jwt.access-secret",
            "social.jwt.refresh-secret",
            "social.jwt.reset-secret",
            "social.jwt.activation-secret",
            "social.public-base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + " is missing");
            }
        }

        String limit = environment.getProperty("social.rate-limit.limit", "100");
        try {
            if (Long.parseLong(limit.trim()) <= 0) {
                problems.add("social.rate-limit.limit must be positive");
            }
        } catch (NumberFormatException ex) {
            problems.add("social.rate-limit.limit must be a number");
        }

        String window = environment.getProperty("social.rate-limit.window", "PT1M");
        try {
            Duration parsed = Duration.parse(window.trim());
            if (parsed.isNegative() || parsed.toMillis() < 1000) {
                problems.add("social.rate-limit.window must be at least one second");
            }
        } catch (DateTimeParseException ex) {
            problems.add("social.rate-limit.window must be an ISO-8601 duration");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("environment check failed: {}", problem));
            throw new IllegalStateException("invalid environment: " + String.join("; ", problems));
        }
        log.info("environment check passed");
    }
}
