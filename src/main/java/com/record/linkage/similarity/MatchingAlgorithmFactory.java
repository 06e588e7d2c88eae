package com.record.linkage.similarity;

import com.record.linkage.config.MatchingOptions;
import com.record.linkage.core.model.AlgorithmType;

/**
 * Creates a new, unprepared algorithm instance for every matching run.
 * Instances are never shared between runs, so their per-run vocabularies cannot leak.
 */
public final class MatchingAlgorithmFactory {

    private MatchingAlgorithmFactory() {
        // Utility class
    }

    public static MatchingAlgorithm create(AlgorithmType type) {
        return create(type, MatchingOptions.defaults());
    }

    public static MatchingAlgorithm create(AlgorithmType type, MatchingOptions options) {
        return switch (type) {
            case LEVENSHTEIN -> new LevenshteinMatcher();
            case JACCARD -> new JaccardMatcher();
            case DICE -> new DiceMatcher();
            case NGRAM -> new NGramMatcher(options.getNgramSize());
            case REGEX -> new RegexMatcher();
            case TFIDF -> new TfIdfMatcher();
        };
    }
}
