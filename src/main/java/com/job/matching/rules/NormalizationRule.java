package com.job.matching.rules;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A case-insensitive regex rewrite applied during normalization.
 * Rules carry a priority (lower runs first) and may be restricted to certain text fields.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<TextField> fields;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.fields = builder.fields != null ? Set.copyOf(builder.fields) : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public Set<TextField> getFields() {
        return fields;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * A rule without explicit fields applies everywhere.
     */
    public boolean appliesTo(TextField field) {
        return fields.isEmpty() || fields.contains(field);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", fields=" + fields +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a rule scoped to one field.
     */
    public static NormalizationRule of(String name, String pattern, String replacement,
                                       TextField field, int priority) {
        return builder()
                .name(name)
                .pattern(pattern)
                .replacement(replacement)
                .fields(field)
                .priority(priority)
                .build();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private Set<TextField> fields;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder fields(TextField... fields) {
            this.fields = Set.of(fields);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
