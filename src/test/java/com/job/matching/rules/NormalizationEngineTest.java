package com.job.matching.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    @Test
    @DisplayName("Should apply rules in priority order regardless of insertion order")
    void testPriorityOrder() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRule(NormalizationRule.of("second", "beta", "gamma", TextField.TITLE, 20));
        engine.addRule(NormalizationRule.of("first", "alpha", "beta", TextField.TITLE, 10));

        assertEquals("gamma", engine.normalize("alpha", TextField.TITLE));
        assertEquals("first", engine.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Field-scoped rules should not leak into other fields")
    void testFieldScope() {
        NormalizationEngine engine = new NormalizationEngine(List.of(
                NormalizationRule.of("title-only", "\\bsr\\b", "senior", TextField.TITLE, 10)));

        assertEquals("senior", engine.normalize("Sr", TextField.TITLE));
        assertEquals("sr", engine.normalize("Sr", TextField.COMPANY));
    }

    @Test
    @DisplayName("Rules without fields apply everywhere and match case-insensitively")
    void testUnscopedRule() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRule(NormalizationRule.builder()
                .name("drop-foo")
                .pattern("foo")
                .replacement("")
                .priority(1)
                .build());

        assertEquals("bar", engine.normalize("FOO bar", TextField.GENERIC));
        assertEquals("bar", engine.normalize("Foo bar", TextField.COMPANY));
    }

    @Test
    @DisplayName("Should remove rules by name")
    void testRemoveRule() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        assertTrue(engine.removeRule("title-senior"));
        assertFalse(engine.removeRule("title-senior"));
        assertEquals("sr engineer", engine.normalize("Sr Engineer", TextField.TITLE));
    }

    @Test
    @DisplayName("Alias table built from a custom map")
    void testCustomAliases() {
        NormalizationEngine engine = DefaultNormalizationRules.createDefaultEngine();
        CompanyAliases aliases = CompanyAliases.of(
                Map.of("initech", List.of("Initech Holdings", "INTC Labs")),
                text -> engine.normalize(text, TextField.COMPANY));
        TextNormalizer normalizer = new TextNormalizer(engine, aliases);

        assertEquals("initech", normalizer.normalizeCompany("Initech Holdings, Inc."));
        assertEquals("initech", normalizer.normalizeCompany("INTC Labs"));
        assertEquals("globex", normalizer.normalizeCompany("Globex"));
        assertEquals(3, aliases.size());
        assertTrue(aliases.lookup("intc labs").isPresent());
        assertTrue(CompanyAliases.empty().lookup("initech").isEmpty());
    }
}
