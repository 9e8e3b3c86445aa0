package com.job.matching.core.model;

public record Certification(
        String name,
        String issuer,
        String issueDate,
        String expiryDate,
        String credentialId
) {
}
