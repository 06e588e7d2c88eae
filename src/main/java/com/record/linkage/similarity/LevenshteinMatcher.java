package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.TextRecord;

import java.util.List;

/**
 * Edit-distance matcher. Scans the whole corpus and keeps the first reference with the highest
 * normalized Levenshtein similarity.
 */
public class LevenshteinMatcher extends AbstractMatchingAlgorithm {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @Override
    public AlgorithmType type() {
        return AlgorithmType.LEVENSHTEIN;
    }

    @Override
    protected MatchResult search(TextRecord query, int queryPosition) {
        List<TextRecord> reference = reference();
        int bestIdx = -1;
        double bestScore = -1.0;
        for (int r = 0; r < reference.size(); r++) {
            double score = similarity.compute(query.normalized(), reference.get(r).normalized());
            if (score > bestScore) {
                bestScore = score;
                bestIdx = r;
                if (score == 1.0) {
                    break;
                }
            }
        }
        return MatchResult.of(query, reference.get(bestIdx), bestScore);
    }
}
