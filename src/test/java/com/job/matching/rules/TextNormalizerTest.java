package com.job.matching.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = TextNormalizer.createDefault();
    }

    @Test
    @DisplayName("Should return empty string for null and blank input")
    void testNullAndBlank() {
        assertEquals("", normalizer.normalizeTitle(null));
        assertEquals("", normalizer.normalizeTitle("   "));
        assertEquals("", normalizer.normalizeCompany(null));
        assertEquals("", normalizer.normalizeCompany(""));
        assertEquals("", normalizer.normalizeText(null));
    }

    @Nested
    @DisplayName("Titles")
    class Titles {

        @ParameterizedTest
        @DisplayName("Should expand abbreviations and fold synonyms")
        @CsvSource({
                "Sr. Software Developer,senior software engineer",
                "Snr Backend Dev,senior backend engineer",
                "Jr. Programmer,junior engineer",
                "Entry-Level Developer,junior engineer",
                "SWE II,software engineer ii",
                "ML Engineer,machine learning engineer",
                "Front-End Developer,frontend engineer",
                "Back End Engineer,backend engineer",
                "Full Stack Developer,fullstack engineer",
                "Dev Ops Engineer,devops engineer"
        })
        void testAbbreviations(String input, String expected) {
            assertEquals(expected, normalizer.normalizeTitle(input));
        }

        @Test
        @DisplayName("Should keep language names that contain symbols")
        void testSymbolLanguages() {
            assertEquals("cpp engineer", normalizer.normalizeTitle("C++ Developer"));
            assertEquals("csharp engineer", normalizer.normalizeTitle("C# Developer"));
            assertEquals("dotnet engineer", normalizer.normalizeTitle(".NET Developer"));
        }

        @Test
        @DisplayName("Should strip hiring noise and work-mode suffixes")
        void testNoise() {
            assertEquals("senior backend engineer",
                    normalizer.normalizeTitle("URGENT: Hiring - Senior Backend Developer (Remote)"));
            assertEquals("data engineer", normalizer.normalizeTitle("Data Engineer - Hybrid"));
            assertEquals("software engineer", normalizer.normalizeTitle("Software Engineer (m/w/d)"));
        }

        @Test
        @DisplayName("Should trim padding before suffix rules run")
        void testPaddedTitle() {
            assertEquals("data engineer", normalizer.normalizeTitle("  Data   Engineer - Hybrid \n"));
        }

        @Test
        @DisplayName("Should be idempotent")
        void testIdempotent() {
            String once = normalizer.normalizeTitle("Sr. Full-Stack Developer (Remote)");
            assertEquals(once, normalizer.normalizeTitle(once));
        }
    }

    @Nested
    @DisplayName("Companies")
    class Companies {

        @ParameterizedTest
        @DisplayName("Should remove legal suffixes")
        @CsvSource({
                "Acme Inc.,acme",
                "'Acme, Inc.',acme",
                "Acme Corporation,acme",
                "Acme Ltd,acme",
                "Acme LLC,acme",
                "Acme GmbH,acme",
                "Acme AG,acme",
                "Acme N.V.,acme",
                "Acme plc,acme"
        })
        void testLegalSuffixes(String input, String expected) {
            assertEquals(expected, normalizer.normalizeCompany(input));
        }

        @Test
        @DisplayName("Should not strip suffix letters that are part of the name")
        void testSuffixNeedsSeparator() {
            assertEquals("cisco", normalizer.normalizeCompany("Cisco"));
            assertEquals("zinc", normalizer.normalizeCompany("Zinc"));
        }

        @Test
        @DisplayName("Should strip suffixes and articles from padded names")
        void testPaddedCompany() {
            assertEquals("google", normalizer.normalizeCompany("Google Inc "));
            assertEquals("acme", normalizer.normalizeCompany(" The Acme Corp\n"));
            assertEquals(normalizer.normalizeCompany("Acme Inc"), normalizer.normalizeCompany("\tAcme  Inc  "));
        }

        @Test
        @DisplayName("Should remove leading article and domain")
        void testArticleAndDomain() {
            assertEquals("coca cola", normalizer.normalizeCompany("The Coca-Cola Company"));
            assertEquals("acme", normalizer.normalizeCompany("acme.io"));
        }

        @Test
        @DisplayName("Should fold ampersand and 'and'")
        void testAnd() {
            assertEquals("procter gamble", normalizer.normalizeCompany("Procter & Gamble"));
            assertEquals("procter gamble", normalizer.normalizeCompany("Procter and Gamble"));
        }

        @ParameterizedTest
        @DisplayName("Should map aliases to the canonical brand")
        @CsvSource({
                "Alphabet,google",
                "Alphabet Inc.,google",
                "Google LLC,google",
                "'Facebook, Inc.',meta",
                "Meta Platforms,meta",
                "AWS,amazon",
                "'Amazon.com, Inc.',amazon",
                "Tesla Motors,tesla"
        })
        void testAliases(String input, String expected) {
            assertEquals(expected, normalizer.normalizeCompany(input));
        }
    }

    @Test
    @DisplayName("Generic text only gets common cleanup")
    void testGenericText() {
        assertEquals("sr developer acme inc", normalizer.normalizeText("Sr. Developer @ Acme, Inc."));
    }
}
