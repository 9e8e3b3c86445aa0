package com.job.matching.scoring;

import com.job.matching.TestFixtures;
import com.job.matching.core.model.JobRequirement;
import com.job.matching.core.model.ParsedResume;
import com.job.matching.core.model.UserPreferences;
import com.job.matching.embedding.EmbeddingProvider;
import com.job.matching.similarity.HybridSimilarityScorer;
import com.job.matching.similarity.LevenshteinSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SkillScorerTest {

    private static final UserPreferences PREFS = UserPreferences.defaults();

    private static ParsedResume resumeWith(String... skills) {
        return ParsedResume.builder().skills("technical", skills).build();
    }

    @Nested
    @DisplayName("Keyword matching")
    class KeywordMatching {

        private final SkillMatcher matcher = new SkillMatcher(new HybridSimilarityScorer());
        private final SkillScorer scorer = new SkillScorer(matcher);

        @Test
        @DisplayName("Two of three required skills score about two thirds")
        void testPartialCoverage() {
            ParsedResume resume = resumeWith("python", "aws", "penetration testing");
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme")
                    .requiredSkills("python", "aws", "kubernetes")
                    .build();

            double score = scorer.score(resume, job, PREFS);

            assertEquals(2.0 / 3.0, score, 1e-9);
            assertEquals(List.of("python", "aws"), matcher.matchingSkills(resume, job));
            assertEquals(List.of("kubernetes"), matcher.missingSkills(resume, job));
        }

        @Test
        @DisplayName("Required and preferred are weighted 0.8 / 0.2")
        void testWeighting() {
            ParsedResume resume = resumeWith("python", "aws");
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme")
                    .requiredSkills("python", "aws")
                    .preferredSkills("terraform", "go")
                    .build();

            assertEquals(0.8, scorer.score(resume, job, PREFS), 1e-9);
        }

        @Test
        @DisplayName("Only preferred skills take the full weight")
        void testPreferredOnly() {
            ParsedResume resume = resumeWith("docker");
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme")
                    .preferredSkills("docker", "helm")
                    .build();

            assertEquals(0.5, scorer.score(resume, job, PREFS), 1e-9);
        }

        @Test
        @DisplayName("Posting without skills scores 0")
        void testNoSkills() {
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme").build();
            assertEquals(0.0, scorer.score(resumeWith("python"), job, PREFS));
        }

        @Test
        @DisplayName("Candidate without skills scores 0")
        void testEmptyCandidate() {
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme").requiredSkills("python").build();
            assertEquals(0.0, scorer.score(ParsedResume.builder().build(), job, PREFS));
        }

        @Test
        @DisplayName("Containment works in both directions and ignores case")
        void testContainment() {
            ParsedResume resume = resumeWith("Spring Boot", "SQL");
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme")
                    .requiredSkills("spring", "PostgreSQL")
                    .build();

            assertEquals(1.0, scorer.score(resume, job, PREFS), 1e-9);
        }

        @Test
        @DisplayName("Near-identical spellings count as matching")
        void testNearSpelling() {
            ParsedResume resume = resumeWith("kubernetes");
            JobRequirement job = TestFixtures.job("j", "Engineer", "Acme")
                    .requiredSkills("kubernets")
                    .build();

            assertEquals(List.of("kubernets"), matcher.matchingSkills(resume, job));
            assertTrue(matcher.missingSkills(resume, job).isEmpty());
        }
    }

    @Nested
    @DisplayName("Semantic matching")
    class SemanticMatching {

        @Test
        @DisplayName("Embeddings give partial credit to synonyms")
        void testSemanticCredit() {
            EmbeddingProvider provider = new MapEmbeddingProvider(Map.of(
                    "k8s", new float[]{1, 0},
                    "kubernetes", new float[]{1, 0}));
            try (HybridSimilarityScorer similarity =
                         new HybridSimilarityScorer(new LevenshteinSimilarity(), provider)) {
                SkillMatcher matcher = new SkillMatcher(similarity);

                double score = matcher.listScore(List.of("k8s"), List.of("kubernetes"));

                // lexical 0.2, semantic 1.0
                assertEquals(0.6, score, 1e-6);
            }
        }

        @Test
        @DisplayName("Match threshold must be a unit score")
        void testThresholdValidation() {
            HybridSimilarityScorer similarity = new HybridSimilarityScorer();
            assertThrows(IllegalArgumentException.class, () -> new SkillMatcher(similarity, 1.5));
        }
    }

    private static final class MapEmbeddingProvider implements EmbeddingProvider {
        private final Map<String, float[]> vectors;

        MapEmbeddingProvider(Map<String, float[]> vectors) {
            this.vectors = vectors;
        }

        @Override
        public float[] embed(String text) {
            return vectors.getOrDefault(text, new float[]{0, 1});
        }

        @Override
        public String getProviderName() {
            return "Map";
        }

        @Override
        public boolean isAvailable() {
            return true;
        }
    }
}
