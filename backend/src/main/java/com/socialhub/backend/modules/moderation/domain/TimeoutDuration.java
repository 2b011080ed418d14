package com.socialhub.backend.modules.moderation.domain;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

public enum TimeoutDuration {

    THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    SIX_HOURS("6h", Duration.ofHours(6)),
    TWELVE_HOURS("12h", Duration.ofHours(12)),
    ONE_DAY("1d", Duration.ofDays(1));

    private final String label;
    private final Duration duration;

    TimeoutDuration(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public Duration duration() {
        return duration;
    }

    public static Optional<TimeoutDuration> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim();
        return Arrays.stream(values())
                .filter(value -> value.label.equals(normalized))
                .findFirst();
    }
}
