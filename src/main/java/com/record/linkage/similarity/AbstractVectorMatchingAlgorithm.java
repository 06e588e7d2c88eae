package com.record.linkage.similarity;

import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.TextRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for matchers that compare sparse term vectors.
 *
 * <p>{@code prepare} fits a {@link Vocabulary} jointly on corpus and queries, vectorizes both and indexes the
 * reference vectors. The search accumulates the per-reference overlap through the {@link InvertedIndex},
 * scores every reference and keeps the first one with the highest score. All structures are owned by this
 * instance and replaced on the next {@code prepare}.</p>
 */
public abstract class AbstractVectorMatchingAlgorithm extends AbstractMatchingAlgorithm {

    private Vocabulary vocabulary;
    private List<SparseVector> referenceVectors = List.of();
    private List<SparseVector> queryVectors = List.of();
    private InvertedIndex index;

    /**
     * Returns how text is split into terms.
     */
    protected abstract TermAnalyzer analyzer();

    /**
     * Returns true if vectors record term presence instead of term counts.
     */
    protected boolean binaryCounts() {
        return false;
    }

    /**
     * Contribution of one shared term to the overlap of a query and a reference.
     */
    protected abstract double combine(double queryWeight, double referenceWeight);

    /**
     * Turns the accumulated overlap into a score. Must return 0 when the denominator is 0.
     */
    protected abstract double similarity(double overlap, SparseVector query, SparseVector reference);

    /**
     * Re-weights the raw count vectors. The default keeps counts as they are.
     */
    protected Vectors weigh(Vocabulary vocabulary, Vectors counts) {
        return counts;
    }

    @Override
    protected void prepareStructures(List<TextRecord> reference, List<TextRecord> queries) {
        Vocabulary fitted = Vocabulary.fit(analyzer(), reference, queries);
        Vectors counts = new Vectors(vectorize(fitted, reference), vectorize(fitted, queries));
        Vectors weighted = weigh(fitted, counts);

        this.vocabulary = fitted;
        this.referenceVectors = weighted.reference();
        this.queryVectors = weighted.queries();
        this.index = new InvertedIndex(fitted.size(), referenceVectors);
    }

    @Override
    protected MatchResult search(TextRecord query, int queryPosition) {
        SparseVector queryVector = queryVectors.get(queryPosition);
        if (queryVector.isEmpty()) {
            return MatchResult.noMatch(query);
        }

        double[] overlap = index.accumulate(queryVector, this::combine);
        int bestIdx = 0;
        double bestScore = -1.0;
        for (int r = 0; r < overlap.length; r++) {
            double score = overlap[r] > 0.0
                    ? clamp(similarity(overlap[r], queryVector, referenceVectors.get(r)))
                    : 0.0;
            if (score > bestScore) {
                bestScore = score;
                bestIdx = r;
            }
        }
        return MatchResult.of(query, reference().get(bestIdx), bestScore);
    }

    /**
     * Returns the vocabulary of the current run, {@code null} before the first prepare.
     */
    protected Vocabulary vocabulary() {
        return vocabulary;
    }

    private List<SparseVector> vectorize(Vocabulary fitted, List<TextRecord> records) {
        List<SparseVector> vectors = new ArrayList<>(records.size());
        for (TextRecord record : records) {
            vectors.add(fitted.vectorize(record.normalized(), binaryCounts()));
        }
        return List.copyOf(vectors);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score) || score <= 0.0) {
            return 0.0;
        }
        return Math.min(1.0, score);
    }

    /**
     * Reference and query vectors of one run, in input order.
     */
    protected record Vectors(List<SparseVector> reference, List<SparseVector> queries) {
    }
}
