package com.job.matching.rules;

import java.util.List;

/**
 * Built-in rules for job titles and company names.
 *
 * <p>Priorities: noise stripping (10), abbreviation expansion (20-25),
 * synonym folding (30), common cleanup (50-200).</p>
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates an engine holding the title, company and common rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getTitleRules());
        engine.addRules(getCompanyRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    public static List<NormalizationRule> getTitleRules() {
        return List.of(
                // "URGENT: Hiring - ..." style lead-ins, possibly stacked
                NormalizationRule.of("title-noise-prefix",
                        "^\\s*(?:(?:urgent(?:ly)?|immediate(?:ly)?|now\\s+hiring|we\\s+are\\s+hiring|hiring|looking\\s+for)\\b[\\s:!\\-]*)+",
                        "", TextField.TITLE, 10),
                // "... (Remote)", "... - Hybrid", "... | On-site"
                NormalizationRule.of("title-work-mode-suffix",
                        "\\s*(?:[-|/]\\s*|\\(\\s*)(?:remote|hybrid|on-?site)\\s*\\)?\\s*$",
                        "", TextField.TITLE, 10),
                // German postings: "(m/w/d)", "(f/m/x)"
                NormalizationRule.of("title-gender-tag",
                        "\\(\\s*[mfwdx]\\s*(?:/\\s*[mfwdx]\\s*)+\\)",
                        "", TextField.TITLE, 15),

                NormalizationRule.of("title-senior", "\\b(?:sr|snr)\\b\\.?", "senior", TextField.TITLE, 20),
                NormalizationRule.of("title-junior", "\\b(?:jr\\b\\.?|entry[\\s-]+level\\b)", "junior", TextField.TITLE, 20),
                NormalizationRule.of("title-swe", "\\bswe\\b", "software engineer", TextField.TITLE, 20),
                NormalizationRule.of("title-ml", "\\bml\\b", "machine learning", TextField.TITLE, 20),
                NormalizationRule.of("title-cpp", "\\bc\\+\\+", "cpp", TextField.TITLE, 25),
                NormalizationRule.of("title-csharp", "\\bc#", "csharp", TextField.TITLE, 25),
                NormalizationRule.of("title-dotnet", "\\.net\\b", "dotnet", TextField.TITLE, 25),

                NormalizationRule.of("title-frontend", "\\bfront[\\s-]?end\\b", "frontend", TextField.TITLE, 30),
                NormalizationRule.of("title-backend", "\\bback[\\s-]?end\\b", "backend", TextField.TITLE, 30),
                NormalizationRule.of("title-fullstack", "\\bfull[\\s-]?stack\\b", "fullstack", TextField.TITLE, 30),
                NormalizationRule.of("title-devops", "\\bdev[\\s-]?ops\\b", "devops", TextField.TITLE, 30),
                NormalizationRule.of("title-engineer", "\\b(?:developer|programmer|dev)\\b", "engineer", TextField.TITLE, 35)
        );
    }

    public static List<NormalizationRule> getCompanyRules() {
        return List.of(
                NormalizationRule.of("company-inc", "(?:,\\s*|\\s+)(?:inc\\.?|incorporated)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-ltd", "(?:,\\s*|\\s+)(?:ltd\\.?|limited)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-corp", "(?:,\\s*|\\s+)(?:corp\\.?|corporation)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-co", "(?:,\\s*|\\s+)(?:co\\.?|company)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-llc", "(?:,\\s*|\\s+)(?:llc|l\\.l\\.c\\.)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-plc", "(?:,\\s*|\\s+)(?:plc|p\\.l\\.c\\.)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-gmbh", "(?:,\\s*|\\s+)gmbh(?:\\s*&\\s*co\\.?\\s*kg)?$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-ag", "(?:,\\s*|\\s+)(?:ag|se)$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-sa", "(?:,\\s*|\\s+)s\\.?a\\.?$", "", TextField.COMPANY, 10),
                NormalizationRule.of("company-nv-bv", "(?:,\\s*|\\s+)[nb]\\.?v\\.?$", "", TextField.COMPANY, 10),
                // applied after legal suffixes so "Amazon.com, Inc." loses both
                NormalizationRule.of("company-domain", "\\.(?:com|io|ai|net)$", "", TextField.COMPANY, 15),
                NormalizationRule.of("company-the", "^the\\s+", "", TextField.COMPANY, 20)
        );
    }

    /**
     * Rules shared by every field.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("common-and")
                        .pattern("\\s+and\\s+")
                        .replacement(" ")
                        .priority(50)
                        .build(),
                NormalizationRule.builder()
                        .name("common-ampersand")
                        .pattern("\\s*&\\s*")
                        .replacement(" ")
                        .priority(50)
                        .build(),
                // keep letters of any script and digits
                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),
                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
