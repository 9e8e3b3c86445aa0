package com.job.matching.matching;

import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.MatchAnalysis;
import com.job.matching.core.model.MatchDimension;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.scoring.ExperienceLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns dimension scores into the narrative part of a match result.
 */
public class MatchAnalyzer {

    public MatchAnalysis analyze(ParsedResume resume, JobRequirement job,
                                 Map<MatchDimension, Double> scores, List<String> missingSkills) {
        double skill = scores.get(MatchDimension.SKILLS);
        double experience = scores.get(MatchDimension.EXPERIENCE);
        double education = scores.get(MatchDimension.EDUCATION);
        double location = scores.get(MatchDimension.LOCATION);

        List<String> strengths = new ArrayList<>();
        if (skill > 0.8) {
            strengths.add("Excellent skill match with job requirements");
        } else if (skill > 0.6) {
            strengths.add("Good skill match with some relevant experience");
        }
        if (experience > 0.8) {
            strengths.add("Experience level aligns well with position");
        }
        if (location > 0.8) {
            strengths.add("Location is compatible with job requirements");
        }

        List<String> weaknesses = new ArrayList<>();
        if (skill < 0.5) {
            weaknesses.add("Limited skill match with job requirements");
        }
        if (experience < 0.5) {
            weaknesses.add("Experience level may not meet job requirements");
        }
        if (education < 0.5) {
            weaknesses.add("Education requirements may not be fully met");
        }

        List<String> recommendations = new ArrayList<>();
        if (skill < 0.7) {
            recommendations.add("Consider acquiring missing technical skills");
        }
        if (experience < 0.7) {
            recommendations.add("Highlight relevant project experience");
        }

        return new MatchAnalysis(
                strengths,
                weaknesses,
                recommendations,
                missingSkills,
                experienceAssessment(resume, job),
                educationAssessment(education),
                locationNotes(job, location),
                overallAssessment(scores)
        );
    }

    static String experienceAssessment(ParsedResume resume, JobRequirement job) {
        double minYears = ExperienceLevel.fromLabel(job.getExperienceLevel())
                .map(ExperienceLevel::getMinYears)
                .orElse(0.0);
        double difference = resume.getTotalExperienceYears() - minYears;
        if (difference > 2) {
            return "Over-qualified based on years of experience";
        } else if (difference >= 0) {
            return "Meets experience requirements";
        }
        return "Below minimum experience requirements";
    }

    static String educationAssessment(double education) {
        if (education >= 1.0) {
            return "Meets education requirements";
        } else if (education >= 0.8) {
            return "One level below the required education";
        } else if (education >= 0.5) {
            return "Below the required education level";
        }
        return "No education listed";
    }

    static String locationNotes(JobRequirement job, double location) {
        if (job.isRemoteFriendly()) {
            return "Remote-friendly position";
        } else if (location >= 0.9) {
            return "Located in a preferred area";
        } else if (location >= 0.8) {
            return "Close to the candidate's current location";
        }
        return "Relocation may be required";
    }

    /**
     * Judged on the unweighted mean of all dimension scores.
     */
    static String overallAssessment(Map<MatchDimension, Double> scores) {
        double mean = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (mean > 0.8) {
            return "Excellent match - highly recommended to apply";
        } else if (mean > 0.6) {
            return "Good match - recommended to apply";
        } else if (mean > 0.4) {
            return "Moderate match - consider applying with tailored application";
        }
        return "Poor match - may not be suitable";
    }
}
