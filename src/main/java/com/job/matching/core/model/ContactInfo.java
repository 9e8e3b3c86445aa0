package com.job.matching.core.model;

/**
 * Candidate contact details as extracted from a resume.
 * Only {@code location} takes part in scoring.
 */
public record ContactInfo(
        String name,
        String email,
        String phone,
        String linkedin,
        String github,
        String portfolio,
        String location
) {
    public static ContactInfo empty() {
        return new ContactInfo(null, null, null, null, null, null, null);
    }

    public static ContactInfo ofLocation(String location) {
        return new ContactInfo(null, null, null, null, null, null, location);
    }

    public boolean hasLocation() {
        return location != null && !location.isBlank();
    }
}
