package com.record.linkage.core.model;

import java.util.Objects;

/**
 * Best match found for one query.
 *
 * <p>{@code bestMatch}, {@code referenceIndex} and {@code score} are absent ({@code null}) when the query
 * had nothing to compare or the corpus was empty. {@code groundTruth} is filled in later by the
 * validation workflow. {@code accepted} is set once by thresholding.</p>
 */
public record MatchResult(
        int queryIndex,
        String query,
        Integer referenceIndex,
        String bestMatch,
        Double score,
        Boolean groundTruth,
        Boolean accepted
) {
    public MatchResult {
        Objects.requireNonNull(query, "query is required");
        if (score != null && (score.isNaN() || score < 0.0 || score > 1.0)) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        if ((referenceIndex == null) != (bestMatch == null)) {
            throw new IllegalArgumentException("referenceIndex and bestMatch must both be present or absent");
        }
    }

    /**
     * Creates a result without a best match.
     */
    public static MatchResult noMatch(TextRecord query) {
        return new MatchResult(query.index(), query.original(), null, null, null, null, null);
    }

    /**
     * Creates a result for a containment search that found nothing: no best match, score {@code false}.
     */
    public static MatchResult notContained(TextRecord query) {
        return new MatchResult(query.index(), query.original(), null, null, 0.0, null, null);
    }

    /**
     * Creates a result pointing at the given reference record.
     */
    public static MatchResult of(TextRecord query, TextRecord reference, double score) {
        return new MatchResult(query.index(), query.original(), reference.index(), reference.original(),
                score, null, null);
    }

    /**
     * Returns true if a best match was found.
     */
    public boolean hasMatch() {
        return bestMatch != null;
    }

    /**
     * Returns true if the match passed its threshold.
     */
    public boolean isAccepted() {
        return Boolean.TRUE.equals(accepted);
    }

    /**
     * Returns a copy carrying the threshold decision.
     */
    public MatchResult withAccepted(boolean value) {
        return new MatchResult(queryIndex, query, referenceIndex, bestMatch, score, groundTruth, value);
    }

    /**
     * Returns a copy carrying the human-validated label.
     */
    public MatchResult withGroundTruth(Boolean value) {
        return new MatchResult(queryIndex, query, referenceIndex, bestMatch, score, value, accepted);
    }
}
