package com.job.matching.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Job posting as delivered by the scraping collaborator. Immutable input.
 * Optional fields are nullable; list fields are never null.
 */
public final class JobRequirement {
    private final String id;
    private final String title;
    private final String company;
    private final String location;
    private final String description;
    private final List<String> requiredSkills;
    private final List<String> preferredSkills;
    private final String experienceLevel;
    private final String educationRequired;
    private final SalaryRange salaryRange;
    private final String jobType;
    private final boolean remoteFriendly;
    private final String industry;
    private final String companySize;
    private final List<String> benefits;
    private final String applicationUrl;
    private final String sourcePlatform;
    private final LocalDate postedDate;

    private JobRequirement(Builder builder) {
        this.id = builder.id;
        this.title = builder.title;
        this.company = builder.company;
        this.location = builder.location;
        this.description = builder.description;
        this.requiredSkills = List.copyOf(builder.requiredSkills);
        this.preferredSkills = List.copyOf(builder.preferredSkills);
        this.experienceLevel = builder.experienceLevel;
        this.educationRequired = builder.educationRequired;
        this.salaryRange = builder.salaryRange;
        this.jobType = builder.jobType;
        this.remoteFriendly = builder.remoteFriendly;
        this.industry = builder.industry;
        this.companySize = builder.companySize;
        this.benefits = List.copyOf(builder.benefits);
        this.applicationUrl = builder.applicationUrl;
        this.sourcePlatform = builder.sourcePlatform;
        this.postedDate = builder.postedDate;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getCompany() {
        return company;
    }

    public String getLocation() {
        return location;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getRequiredSkills() {
        return requiredSkills;
    }

    public List<String> getPreferredSkills() {
        return preferredSkills;
    }

    public String getExperienceLevel() {
        return experienceLevel;
    }

    public String getEducationRequired() {
        return educationRequired;
    }

    public Optional<SalaryRange> getSalaryRange() {
        return Optional.ofNullable(salaryRange);
    }

    public String getJobType() {
        return jobType;
    }

    public boolean isRemoteFriendly() {
        return remoteFriendly;
    }

    public String getIndustry() {
        return industry;
    }

    public String getCompanySize() {
        return companySize;
    }

    public List<String> getBenefits() {
        return benefits;
    }

    public String getApplicationUrl() {
        return applicationUrl;
    }

    public String getSourcePlatform() {
        return sourcePlatform;
    }

    public LocalDate getPostedDate() {
        return postedDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobRequirement that = (JobRequirement) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRequirement{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", company='" + company + '\'' +
                ", location='" + location + '\'' +
                ", experienceLevel='" + experienceLevel + '\'' +
                ", remoteFriendly=" + remoteFriendly +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String company;
        private String location;
        private String description;
        private List<String> requiredSkills = List.of();
        private List<String> preferredSkills = List.of();
        private String experienceLevel;
        private String educationRequired;
        private SalaryRange salaryRange;
        private String jobType;
        private boolean remoteFriendly;
        private String industry;
        private String companySize;
        private List<String> benefits = List.of();
        private String applicationUrl;
        private String sourcePlatform;
        private LocalDate postedDate;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder company(String company) {
            this.company = company;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder requiredSkills(List<String> requiredSkills) {
            this.requiredSkills = Objects.requireNonNull(requiredSkills);
            return this;
        }

        public Builder requiredSkills(String... requiredSkills) {
            return requiredSkills(List.of(requiredSkills));
        }

        public Builder preferredSkills(List<String> preferredSkills) {
            this.preferredSkills = Objects.requireNonNull(preferredSkills);
            return this;
        }

        public Builder preferredSkills(String... preferredSkills) {
            return preferredSkills(List.of(preferredSkills));
        }

        public Builder experienceLevel(String experienceLevel) {
            this.experienceLevel = experienceLevel;
            return this;
        }

        public Builder educationRequired(String educationRequired) {
            this.educationRequired = educationRequired;
            return this;
        }

        public Builder salaryRange(SalaryRange salaryRange) {
            this.salaryRange = salaryRange;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder remoteFriendly(boolean remoteFriendly) {
            this.remoteFriendly = remoteFriendly;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public Builder companySize(String companySize) {
            this.companySize = companySize;
            return this;
        }

        public Builder benefits(List<String> benefits) {
            this.benefits = Objects.requireNonNull(benefits);
            return this;
        }

        public Builder applicationUrl(String applicationUrl) {
            this.applicationUrl = applicationUrl;
            return this;
        }

        public Builder sourcePlatform(String sourcePlatform) {
            this.sourcePlatform = sourcePlatform;
            return this;
        }

        public Builder postedDate(LocalDate postedDate) {
            this.postedDate = postedDate;
            return this;
        }

        public JobRequirement build() {
            Objects.requireNonNull(id, "id is required");
            return new JobRequirement(this);
        }
    }
}
