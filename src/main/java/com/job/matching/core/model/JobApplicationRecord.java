package com.job.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * A posting that has been accepted into the duplicate index.
 * Only {@code status} ever changes after insertion, via {@link #withStatus(String)}.
 *
 * <p>Serialized with the snake_case field names of the persisted index. Unknown
 * fields are ignored and missing text fields load as empty strings.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobApplicationRecord(
        @JsonProperty("job_id") String id,
        @JsonProperty("job_title") String jobTitle,
        @JsonProperty("company") String company,
        @JsonProperty("normalized_title") String normalizedTitle,
        @JsonProperty("normalized_company") String normalizedCompany,
        @JsonProperty("job_url") String jobUrl,
        @JsonProperty("application_date") String applicationDate,
        @JsonProperty("job_description") String jobDescription,
        @JsonProperty("location") String location,
        @JsonProperty("salary_range") String salaryRange,
        @JsonProperty("job_source") String jobSource,
        @JsonProperty("application_status") String status,
        @JsonProperty("similarity_score") double similarityScore,
        @JsonProperty("duplicate_of") String duplicateOf
) {
    public JobApplicationRecord {
        Objects.requireNonNull(id, "id is required");
        jobTitle = nullToEmpty(jobTitle);
        company = nullToEmpty(company);
        normalizedTitle = nullToEmpty(normalizedTitle);
        normalizedCompany = nullToEmpty(normalizedCompany);
        jobUrl = nullToEmpty(jobUrl);
        applicationDate = nullToEmpty(applicationDate);
        jobDescription = nullToEmpty(jobDescription);
        location = nullToEmpty(location);
        salaryRange = nullToEmpty(salaryRange);
        jobSource = nullToEmpty(jobSource);
        status = status == null || status.isBlank() ? ApplicationStatus.APPLIED.value() : status;
        duplicateOf = nullToEmpty(duplicateOf);
    }

    public JobApplicationRecord withStatus(String newStatus) {
        return new JobApplicationRecord(id, jobTitle, company, normalizedTitle, normalizedCompany, jobUrl,
                applicationDate, jobDescription, location, salaryRange, jobSource, newStatus,
                similarityScore, duplicateOf);
    }

    public JobApplicationRecord withNormalized(String title, String companyName) {
        return new JobApplicationRecord(id, jobTitle, company, title, companyName, jobUrl,
                applicationDate, jobDescription, location, salaryRange, jobSource, status,
                similarityScore, duplicateOf);
    }

    /**
     * Id of the earlier record this one was flagged as a potential duplicate of.
     */
    public Optional<String> duplicateOfId() {
        return duplicateOf.isEmpty() ? Optional.empty() : Optional.of(duplicateOf);
    }

    public boolean hasStatus(ApplicationStatus expected) {
        return expected.value().equalsIgnoreCase(status);
    }

    /**
     * Parses the application date, accepting both instants and zone-less local
     * timestamps (taken as UTC).
     */
    public Optional<Instant> appliedAt() {
        if (applicationDate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(applicationDate));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(LocalDateTime.parse(applicationDate).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String jobTitle;
        private String company;
        private String normalizedTitle;
        private String normalizedCompany;
        private String jobUrl;
        private String applicationDate;
        private String jobDescription;
        private String location;
        private String salaryRange;
        private String jobSource;
        private String status = ApplicationStatus.APPLIED.value();
        private double similarityScore;
        private String duplicateOf;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder normalizedTitle(String normalizedTitle) {
            this.normalizedTitle = normalizedTitle;
            return this;
        }

        public Builder normalizedCompany(String normalizedCompany) {
            this.normalizedCompany = normalizedCompany;
            return this;
        }

        public Builder jobUrl(String jobUrl) {
            this.jobUrl = jobUrl;
            return this;
        }

        public Builder applicationDate(Instant applicationDate) {
            this.applicationDate = applicationDate != null ? applicationDate.toString() : null;
            return this;
        }

        public Builder jobDescription(String jobDescription) {
            this.jobDescription = jobDescription;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder salaryRange(String salaryRange) {
            this.salaryRange = salaryRange;
            return this;
        }

        public Builder jobSource(String jobSource) {
            this.jobSource = jobSource;
            return this;
        }

        public Builder status(ApplicationStatus status) {
            this.status = status.value();
            return this;
        }

        public Builder similarityScore(double similarityScore) {
            this.similarityScore = similarityScore;
            return this;
        }

        public Builder duplicateOf(String duplicateOf) {
            this.duplicateOf = duplicateOf;
            return this;
        }

        public JobApplicationRecord build() {
            return new JobApplicationRecord(id, jobTitle, company, normalizedTitle, normalizedCompany, jobUrl,
                    applicationDate, jobDescription, location, salaryRange, jobSource, status,
                    similarityScore, duplicateOf);
        }
    }
}
