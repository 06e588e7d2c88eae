package com.record.linkage.core.model;

import java.util.Locale;

/**
 * The six interchangeable similarity algorithms.
 * Each carries its export name, default threshold and score shape.
 */
public enum AlgorithmType {
    LEVENSHTEIN("LEVENSHTEIN", 0.8, ScoreKind.CONTINUOUS),
    JACCARD("JACCARD", 0.5, ScoreKind.CONTINUOUS),
    DICE("DICE", 0.5, ScoreKind.CONTINUOUS),
    NGRAM("NGRAM", 0.5, ScoreKind.CONTINUOUS),
    REGEX("REGEX", 0.5, ScoreKind.BOOLEAN),
    TFIDF("TFIDF", 0.5, ScoreKind.CONTINUOUS);

    private final String exportName;
    private final double defaultThreshold;
    private final ScoreKind scoreKind;

    AlgorithmType(String exportName, double defaultThreshold, ScoreKind scoreKind) {
        this.exportName = exportName;
        this.defaultThreshold = defaultThreshold;
        this.scoreKind = scoreKind;
    }

    /**
     * Upper-case name used as column prefix in exported and validated tables.
     */
    public String getExportName() {
        return exportName;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public ScoreKind getScoreKind() {
        return scoreKind;
    }

    /**
     * Column holding the human-validated label for this algorithm.
     */
    public String trueMatchColumn() {
        return exportName + "_TRUE_MATCH";
    }

    /**
     * Column holding the thresholded decision for this algorithm.
     */
    public String binaryColumn() {
        return exportName + "_BEST_MATCH_BINARY";
    }

    /**
     * Resolves an algorithm from a configuration key such as {@code "levenshtein"}.
     *
     * @throws IllegalArgumentException if the key names no algorithm
     */
    public static AlgorithmType fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Algorithm key must not be blank");
        }
        String upper = key.trim().toUpperCase(Locale.ROOT);
        for (AlgorithmType type : values()) {
            if (type.exportName.equals(upper)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + key);
    }
}
