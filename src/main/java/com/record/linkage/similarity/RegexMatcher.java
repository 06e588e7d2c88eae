package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.TextRecord;

/**
 * Containment matcher. The first reference that contains the query, or is contained in it,
 * wins with a boolean score of {@code true} (1.0). Without any containing reference the score is
 * {@code false} (0.0) and there is no best match.
 */
public class RegexMatcher extends AbstractMatchingAlgorithm {

    private final ContainmentSimilarity containment = new ContainmentSimilarity();

    @Override
    public AlgorithmType type() {
        return AlgorithmType.REGEX;
    }

    @Override
    protected MatchResult search(TextRecord query, int queryPosition) {
        for (TextRecord candidate : reference()) {
            if (containment.contains(query.normalized(), candidate.normalized())) {
                return MatchResult.of(query, candidate, 1.0);
            }
        }
        return MatchResult.notContained(query);
    }
}
