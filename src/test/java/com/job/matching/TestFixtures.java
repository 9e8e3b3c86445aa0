package com.job.matching;

import com.job.matching.core.model.ContactInfo;
import com.job.matching.core.model.Education;
import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.SalaryRange;
import com.job.matching.core.model.UserPreferences;
import com.job.matching.core.model.WorkExperience;

import java.util.List;
import java.util.Map;

/**
 * Shared resumes and postings for tests.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    /**
     * Six years, master's degree, ex-Google, web background, based in Berlin.
     */
    public static ParsedResume strongResume() {
        return ParsedResume.builder()
                .contactInfo(ContactInfo.ofLocation("Berlin, Germany"))
                .skills("programming_languages", "python", "java")
                .skills("cloud_platforms", "aws", "docker", "kubernetes")
                .workExperience(List.of(WorkExperience.of("Software Engineer", "Google LLC", 72)))
                .education(List.of(Education.of("Master of Science", "Computer Science")))
                .totalExperienceYears(6)
                .primaryDomain("web_technologies")
                .skillConfidenceScores(Map.of("python", 0.9, "aws", 0.6, "kubernetes", 0.8, "docker", 0.7))
                .build();
    }

    /**
     * One year, no degree, based in Tokyo.
     */
    public static ParsedResume weakResume() {
        return ParsedResume.builder()
                .contactInfo(ContactInfo.ofLocation("Tokyo"))
                .skills("tools", "excel")
                .totalExperienceYears(1)
                .build();
    }

    /**
     * Senior remote posting the strong resume covers completely.
     */
    public static JobRequirement seniorPythonJob(String id) {
        return JobRequirement.builder()
                .id(id)
                .title("Senior Python Engineer")
                .company("Acme Corp")
                .location("Berlin")
                .description("Build data services in Python on AWS and Kubernetes.")
                .requiredSkills("python", "aws", "kubernetes")
                .preferredSkills("docker")
                .experienceLevel("Senior")
                .educationRequired("Bachelor's degree")
                .salaryRange(SalaryRange.of(80_000, 100_000))
                .remoteFriendly(true)
                .industry("Technology")
                .companySize("Large")
                .applicationUrl("https://careers.acme.example/jobs/" + id)
                .sourcePlatform("company_site")
                .build();
    }

    public static JobRequirement.Builder job(String id, String title, String company) {
        return JobRequirement.builder()
                .id(id)
                .title(title)
                .company(company);
    }

    public static UserPreferences preferences(String... locations) {
        return new UserPreferences(List.of(locations), 70_000L, List.of(), List.of(), List.of());
    }
}
