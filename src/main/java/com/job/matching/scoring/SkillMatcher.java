package com.job.matching.scoring;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.similarity.HybridSimilarityScorer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Compares posting skills with candidate skills.
 *
 * <p>With a semantic backend each posting skill scores its best similarity over the
 * candidate's skills. Without one it scores 1 when some candidate skill contains it
 * (or is contained by it) and 0 otherwise.</p>
 */
public class SkillMatcher {

    public static final double DEFAULT_MATCH_THRESHOLD = 0.85;

    private final HybridSimilarityScorer similarity;
    private final double matchThreshold;

    public SkillMatcher(HybridSimilarityScorer similarity) {
        this(similarity, DEFAULT_MATCH_THRESHOLD);
    }

    public SkillMatcher(HybridSimilarityScorer similarity, double matchThreshold) {
        if (matchThreshold < 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("matchThreshold must be between 0.0 and 1.0");
        }
        this.similarity = similarity;
        this.matchThreshold = matchThreshold;
    }

    /**
     * Mean per-skill score of {@code jobSkills} against {@code candidateSkills};
     * 0.0 when either side is empty.
     */
    public double listScore(List<String> candidateSkills, List<String> jobSkills) {
        List<String> candidates = clean(candidateSkills);
        List<String> wanted = clean(jobSkills);
        if (candidates.isEmpty() || wanted.isEmpty()) {
            return 0.0;
        }

        boolean semantic = similarity.isSemanticEnabled();
        double total = 0.0;
        for (String jobSkill : wanted) {
            total += semantic ? bestSimilarity(jobSkill, candidates) : (containedInAny(jobSkill, candidates) ? 1.0 : 0.0);
        }
        return Math.min(1.0, total / wanted.size());
    }

    /**
     * Posting skills (required then preferred) the candidate covers, in posting order.
     */
    public List<String> matchingSkills(ParsedResume resume, JobRequirement job) {
        List<String> candidates = clean(resume.getAllSkills());
        Set<String> matching = new LinkedHashSet<>();
        for (String jobSkill : clean(concat(job.getRequiredSkills(), job.getPreferredSkills()))) {
            if (covers(jobSkill, candidates)) {
                matching.add(jobSkill);
            }
        }
        return List.copyOf(matching);
    }

    /**
     * Required skills the candidate does not cover, in posting order.
     */
    public List<String> missingSkills(ParsedResume resume, JobRequirement job) {
        List<String> candidates = clean(resume.getAllSkills());
        Set<String> missing = new LinkedHashSet<>();
        for (String jobSkill : clean(job.getRequiredSkills())) {
            if (!covers(jobSkill, candidates)) {
                missing.add(jobSkill);
            }
        }
        return List.copyOf(missing);
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    private boolean covers(String jobSkill, List<String> candidates) {
        return containedInAny(jobSkill, candidates) || bestSimilarity(jobSkill, candidates) >= matchThreshold;
    }

    private double bestSimilarity(String jobSkill, List<String> candidates) {
        double best = 0.0;
        for (String candidate : candidates) {
            best = Math.max(best, similarity.compute(jobSkill.toLowerCase(Locale.ROOT),
                    candidate.toLowerCase(Locale.ROOT)));
            if (best >= 1.0) {
                break;
            }
        }
        return best;
    }

    private static boolean containedInAny(String jobSkill, List<String> candidates) {
        String wanted = jobSkill.toLowerCase(Locale.ROOT);
        for (String candidate : candidates) {
            String have = candidate.toLowerCase(Locale.ROOT);
            if (have.contains(wanted) || wanted.contains(have)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> concat(List<String> first, List<String> second) {
        List<String> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static List<String> clean(List<String> skills) {
        List<String> cleaned = new ArrayList<>();
        for (String skill : skills) {
            if (skill != null && !skill.isBlank()) {
                cleaned.add(skill.trim());
            }
        }
        return cleaned;
    }
}
