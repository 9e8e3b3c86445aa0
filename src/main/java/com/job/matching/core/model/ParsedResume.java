package com.job.matching.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Candidate record produced by the resume-parsing collaborator.
 * Immutable; every collection is copied on construction and exposed read-only.
 */
public final class ParsedResume {
    private final ContactInfo contactInfo;
    private final String summary;
    private final Map<String, Set<String>> skills;
    private final List<WorkExperience> workExperience;
    private final List<Education> education;
    private final List<Certification> certifications;
    private final List<String> projects;
    private final List<String> languages;
    private final List<String> awards;
    private final List<String> publications;
    private final String rawText;
    private final String filePath;
    private final Instant parsedAt;
    private final double totalExperienceYears;
    private final String seniorityLevel;
    private final String primaryDomain;
    private final Map<String, Double> skillConfidenceScores;

    private ParsedResume(Builder builder) {
        this.contactInfo = builder.contactInfo != null ? builder.contactInfo : ContactInfo.empty();
        this.summary = builder.summary;
        Map<String, Set<String>> skillCopy = new LinkedHashMap<>();
        builder.skills.forEach((category, values) ->
                skillCopy.put(category, Collections.unmodifiableSet(new LinkedHashSet<>(values))));
        this.skills = Collections.unmodifiableMap(skillCopy);
        this.workExperience = List.copyOf(builder.workExperience);
        this.education = List.copyOf(builder.education);
        this.certifications = List.copyOf(builder.certifications);
        this.projects = List.copyOf(builder.projects);
        this.languages = List.copyOf(builder.languages);
        this.awards = List.copyOf(builder.awards);
        this.publications = List.copyOf(builder.publications);
        this.rawText = builder.rawText;
        this.filePath = builder.filePath;
        this.parsedAt = builder.parsedAt;
        this.totalExperienceYears = builder.totalExperienceYears;
        this.seniorityLevel = builder.seniorityLevel;
        this.primaryDomain = builder.primaryDomain;
        this.skillConfidenceScores = Collections.unmodifiableMap(new LinkedHashMap<>(builder.skillConfidenceScores));
    }

    public ContactInfo getContactInfo() {
        return contactInfo;
    }

    public String getSummary() {
        return summary;
    }

    /**
     * Skills grouped by category (e.g. {@code programming_languages -> {python, java}}).
     */
    public Map<String, Set<String>> getSkills() {
        return skills;
    }

    /**
     * Union of all skill categories in first-seen order, without duplicates.
     */
    public List<String> getAllSkills() {
        Set<String> union = new LinkedHashSet<>();
        for (Set<String> category : skills.values()) {
            for (String skill : category) {
                if (skill != null && !skill.isBlank()) {
                    union.add(skill);
                }
            }
        }
        return List.copyOf(union);
    }

    public List<WorkExperience> getWorkExperience() {
        return workExperience;
    }

    public List<Education> getEducation() {
        return education;
    }

    public boolean hasEducation() {
        return !education.isEmpty();
    }

    public List<Certification> getCertifications() {
        return certifications;
    }

    public List<String> getProjects() {
        return projects;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public List<String> getAwards() {
        return awards;
    }

    public List<String> getPublications() {
        return publications;
    }

    public String getRawText() {
        return rawText;
    }

    public String getFilePath() {
        return filePath;
    }

    public Instant getParsedAt() {
        return parsedAt;
    }

    public double getTotalExperienceYears() {
        return totalExperienceYears;
    }

    public String getSeniorityLevel() {
        return seniorityLevel;
    }

    public String getPrimaryDomain() {
        return primaryDomain;
    }

    public Map<String, Double> getSkillConfidenceScores() {
        return skillConfidenceScores;
    }

    /**
     * Confidence for a skill, case-insensitive, 0.0 when unknown.
     */
    public double skillConfidence(String skill) {
        if (skill == null) {
            return 0.0;
        }
        for (Map.Entry<String, Double> entry : skillConfidenceScores.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(skill)) {
                return entry.getValue();
            }
        }
        return 0.0;
    }

    @Override
    public String toString() {
        return "ParsedResume{" +
                "name='" + contactInfo.name() + '\'' +
                ", skills=" + getAllSkills().size() +
                ", totalExperienceYears=" + totalExperienceYears +
                ", seniorityLevel='" + seniorityLevel + '\'' +
                ", primaryDomain='" + primaryDomain + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ContactInfo contactInfo;
        private String summary;
        private final Map<String, Set<String>> skills = new LinkedHashMap<>();
        private List<WorkExperience> workExperience = List.of();
        private List<Education> education = List.of();
        private List<Certification> certifications = List.of();
        private List<String> projects = List.of();
        private List<String> languages = List.of();
        private List<String> awards = List.of();
        private List<String> publications = List.of();
        private String rawText;
        private String filePath;
        private Instant parsedAt;
        private double totalExperienceYears;
        private String seniorityLevel;
        private String primaryDomain;
        private Map<String, Double> skillConfidenceScores = Map.of();

        public Builder contactInfo(ContactInfo contactInfo) {
            this.contactInfo = contactInfo;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder skills(String category, String... values) {
            this.skills.computeIfAbsent(category, k -> new LinkedHashSet<>()).addAll(List.of(values));
            return this;
        }

        public Builder skills(Map<String, ? extends Set<String>> skills) {
            skills.forEach((category, values) ->
                    this.skills.computeIfAbsent(category, k -> new LinkedHashSet<>()).addAll(values));
            return this;
        }

        public Builder workExperience(List<WorkExperience> workExperience) {
            this.workExperience = Objects.requireNonNull(workExperience);
            return this;
        }

        public Builder education(List<Education> education) {
            this.education = Objects.requireNonNull(education);
            return this;
        }

        public Builder certifications(List<Certification> certifications) {
            this.certifications = Objects.requireNonNull(certifications);
            return this;
        }

        public Builder projects(List<String> projects) {
            this.projects = Objects.requireNonNull(projects);
            return this;
        }

        public Builder languages(List<String> languages) {
            this.languages = Objects.requireNonNull(languages);
            return this;
        }

        public Builder awards(List<String> awards) {
            this.awards = Objects.requireNonNull(awards);
            return this;
        }

        public Builder publications(List<String> publications) {
            this.publications = Objects.requireNonNull(publications);
            return this;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder parsedAt(Instant parsedAt) {
            this.parsedAt = parsedAt;
            return this;
        }

        public Builder totalExperienceYears(double totalExperienceYears) {
            if (totalExperienceYears < 0) {
                throw new IllegalArgumentException("totalExperienceYears must not be negative");
            }
            this.totalExperienceYears = totalExperienceYears;
            return this;
        }

        public Builder seniorityLevel(String seniorityLevel) {
            this.seniorityLevel = seniorityLevel;
            return this;
        }

        public Builder primaryDomain(String primaryDomain) {
            this.primaryDomain = primaryDomain;
            return this;
        }

        public Builder skillConfidenceScores(Map<String, Double> skillConfidenceScores) {
            this.skillConfidenceScores = Objects.requireNonNull(skillConfidenceScores);
            return this;
        }

        public ParsedResume build() {
            for (Map.Entry<String, Double> entry : skillConfidenceScores.entrySet()) {
                double value = entry.getValue();
                if (value < 0.0 || value > 1.0) {
                    throw new IllegalArgumentException(
                            "Skill confidence for '" + entry.getKey() + "' must be between 0.0 and 1.0");
                }
            }
            return new ParsedResume(this);
        }
    }
}
