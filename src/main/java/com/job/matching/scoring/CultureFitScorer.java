package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;
import com.job.matching.core.model.WorkExperience;
import com.job.matching.rules.TextNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Base 0.5, plus 0.3 when the posting's industry suits the candidate's primary domain,
 * plus 0.2 when the company size fits the candidate's employer history
 * (large-company background for Large, otherwise Startup or Small). Capped at 1.0.
 */
public class CultureFitScorer implements DimensionScorer {

    static final double BASE_SCORE = 0.5;
    static final double INDUSTRY_BONUS = 0.3;
    static final double COMPANY_SIZE_BONUS = 0.2;

    private static final Map<String, List<String>> DOMAIN_INDUSTRIES = Map.of(
            "cybersecurity", List.of("Security", "Financial Services", "Technology"),
            "data_science", List.of("Technology", "Healthcare", "Finance"),
            "web_technologies", List.of("Technology", "E-commerce", "Media")
    );

    private static final Set<String> BIG_COMPANIES = Set.of(
            "google", "microsoft", "amazon", "apple", "meta", "netflix");

    private final TextNormalizer normalizer;

    public CultureFitScorer(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public MatchDimension dimension() {
        return MatchDimension.CULTURE;
    }

    @Override
    public double score(ParsedResume resume, JobRequirement job, UserPreferences preferences) {
        double score = BASE_SCORE;

        String domain = resume.getPrimaryDomain();
        if (domain != null && job.getIndustry() != null) {
            List<String> industries = DOMAIN_INDUSTRIES.getOrDefault(domain.trim().toLowerCase(Locale.ROOT), List.of());
            if (industries.stream().anyMatch(i -> i.equalsIgnoreCase(job.getIndustry().trim()))) {
                score += INDUSTRY_BONUS;
            }
        }

        List<WorkExperience> history = resume.getWorkExperience();
        String size = job.getCompanySize();
        if (!history.isEmpty() && size != null) {
            boolean bigCompanyBackground = history.stream()
                    .map(exp -> normalizer.normalizeCompany(exp.company()))
                    .anyMatch(BIG_COMPANIES::contains);
            String bucket = size.trim();
            if (bigCompanyBackground && bucket.equalsIgnoreCase("Large")) {
                score += COMPANY_SIZE_BONUS;
            } else if (!bigCompanyBackground
                    && (bucket.equalsIgnoreCase("Startup") || bucket.equalsIgnoreCase("Small"))) {
                score += COMPANY_SIZE_BONUS;
            }
        }

        return Math.min(score, 1.0);
    }
}
