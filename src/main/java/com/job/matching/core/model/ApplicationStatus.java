package com.job.matching.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Well-known lifecycle states of a recorded application.
 * Stored as their lower-case {@link #value()} so records written by older
 * tools with free-form statuses still load.
 */
public enum ApplicationStatus {
    APPLIED("applied"),
    VIEWED("viewed"),
    INTERVIEWED("interviewed"),
    OFFERED("offered"),
    REJECTED("rejected"),
    NO_RESPONSE("no_response"),
    WITHDRAWN("withdrawn");

    private final String value;

    ApplicationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ApplicationStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ApplicationStatus status : values()) {
            if (status.value.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
