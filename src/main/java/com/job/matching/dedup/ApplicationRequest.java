package com.job.matching.dedup;

import com.job.matching.core.model.JobRequirement;

/**
 * Fields of a posting about to be checked against, or added to, the duplicate index.
 */
public record ApplicationRequest(
        String title,
        String company,
        String url,
        String description,
        String location,
        String salaryRange,
        String source
) {
    public ApplicationRequest {
        title = title != null ? title : "";
        company = company != null ? company : "";
        url = url != null ? url.trim() : "";
        description = description != null ? description : "";
        location = location != null ? location : "";
        salaryRange = salaryRange != null ? salaryRange : "";
        source = source != null ? source : "";
    }

    public static ApplicationRequest of(String title, String company, String url, String description) {
        return new ApplicationRequest(title, company, url, description, null, null, null);
    }

    public static ApplicationRequest from(JobRequirement job) {
        return new ApplicationRequest(
                job.getTitle(),
                job.getCompany(),
                job.getApplicationUrl(),
                job.getDescription(),
                job.getLocation(),
                job.getSalaryRange().map(Object::toString).orElse(null),
                job.getSourcePlatform()
        );
    }
}
