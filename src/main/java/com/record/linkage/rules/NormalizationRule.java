package com.record.linkage.rules;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A substring replacement applied to raw text before comparison.
 * Patterns are matched case-insensitively (Unicode aware); rules run in ascending priority order.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final String quotedReplacement;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.quotedReplacement = Matcher.quoteReplacement(builder.replacement);
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Replaces every match in {@code input}. A {@code null} input stays {@code null}.
     */
    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(quotedReplacement);
    }

    /**
     * Rules are identified by name; an engine holds at most one rule per name.
     */
    @Override
    public boolean equals(Object o) {
        return o instanceof NormalizationRule other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name + "[" + pattern.pattern() + " -> " + replacement + ", priority " + priority + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        /**
         * Matches the given text literally instead of as a regular expression.
         */
        public Builder literal(String text) {
            this.pattern = Pattern.quote(text);
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
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
