package com.job.matching.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Applies {@link NormalizationRule}s in priority order, then lower-cases.
 * Whitespace is trimmed and collapsed before the first rule and after every rule
 * that changes the text, so anchored patterns see clean edges. Safe to share between threads.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CopyOnWriteArrayList<NormalizationRule> rules = new CopyOnWriteArrayList<>();

    public NormalizationEngine() {
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        addRules(rules);
    }

    public void addRule(NormalizationRule rule) {
        addRules(List.of(rule));
    }

    public synchronized void addRules(List<NormalizationRule> newRules) {
        List<NormalizationRule> merged = new ArrayList<>(rules);
        merged.addAll(newRules);
        merged.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        rules.clear();
        rules.addAll(merged);
    }

    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes text for the given field; null or blank input yields {@code ""}.
     */
    public String normalize(String text, TextField field) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = collapseWhitespace(text);
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(field)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    result = collapseWhitespace(result);
                    if (log.isTraceEnabled()) {
                        log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                    }
                }
            }
        }

        return result.toLowerCase(Locale.ROOT);
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }
}
