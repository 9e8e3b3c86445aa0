package com.job.matching.similarity;

import java.util.Locale;

/**
 * Case-insensitive edit-distance ratio: {@code 1 - distance / maxLength}.
 */
public class LevenshteinSimilarity implements LexicalSimilarity {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        String a = s1.toLowerCase(Locale.ROOT);
        String b = s2.toLowerCase(Locale.ROOT);
        if (a.equals(b)) {
            return 1.0;
        }
        int distance = distance(a, b);
        return 1.0 - ((double) distance / Math.max(a.length(), b.length()));
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Wagner-Fischer with two rows sized to the shorter input.
     */
    static int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] previous = new int[shorter.length() + 1];
        int[] current = new int[shorter.length() + 1];
        for (int i = 0; i < previous.length; i++) {
            previous[i] = i;
        }

        for (int j = 1; j <= longer.length(); j++) {
            current[0] = j;
            char c = longer.charAt(j - 1);
            for (int i = 1; i <= shorter.length(); i++) {
                int substitution = previous[i - 1] + (shorter.charAt(i - 1) == c ? 0 : 1);
                current[i] = Math.min(substitution, Math.min(previous[i], current[i - 1]) + 1);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[shorter.length()];
    }
}
