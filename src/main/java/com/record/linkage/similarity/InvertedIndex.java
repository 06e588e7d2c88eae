package com.record.linkage.similarity;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Postings from term id to the reference vectors containing it.
 * Built once per run and read concurrently afterwards.
 */
final class InvertedIndex {

    private final int[][] postingRefs;
    private final double[][] postingWeights;
    private final int referenceCount;

    InvertedIndex(int vocabularySize, List<SparseVector> references) {
        this.referenceCount = references.size();
        int[] lengths = new int[vocabularySize];
        for (SparseVector vector : references) {
            for (int i = 0; i < vector.nnz(); i++) {
                lengths[vector.indexAt(i)]++;
            }
        }

        postingRefs = new int[vocabularySize][];
        postingWeights = new double[vocabularySize][];
        for (int t = 0; t < vocabularySize; t++) {
            postingRefs[t] = new int[lengths[t]];
            postingWeights[t] = new double[lengths[t]];
        }

        int[] fill = new int[vocabularySize];
        for (int r = 0; r < references.size(); r++) {
            SparseVector vector = references.get(r);
            for (int i = 0; i < vector.nnz(); i++) {
                int term = vector.indexAt(i);
                postingRefs[term][fill[term]] = r;
                postingWeights[term][fill[term]] = vector.valueAt(i);
                fill[term]++;
            }
        }
    }

    /**
     * Accumulates, per reference, {@code combine(queryWeight, referenceWeight)} over the terms
     * shared with the query. References without a shared term stay at 0.
     */
    double[] accumulate(SparseVector query, DoubleBinaryOperator combine) {
        double[] overlap = new double[referenceCount];
        for (int i = 0; i < query.nnz(); i++) {
            int term = query.indexAt(i);
            double queryWeight = query.valueAt(i);
            int[] refs = postingRefs[term];
            double[] weights = postingWeights[term];
            for (int p = 0; p < refs.length; p++) {
                overlap[refs[p]] += combine.applyAsDouble(queryWeight, weights[p]);
            }
        }
        return overlap;
    }
}
