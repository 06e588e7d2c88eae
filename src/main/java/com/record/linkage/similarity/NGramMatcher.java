package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;

/**
 * Character n-gram overlap: |q ∩ r| / (|q| + |r| - |q ∩ r|) on n-gram counts.
 */
public class NGramMatcher extends AbstractVectorMatchingAlgorithm {

    public static final int DEFAULT_N = 2;

    private final int n;

    public NGramMatcher() {
        this(DEFAULT_N);
    }

    public NGramMatcher(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        this.n = n;
    }

    public int getN() {
        return n;
    }

    @Override
    public AlgorithmType type() {
        return AlgorithmType.NGRAM;
    }

    @Override
    protected TermAnalyzer analyzer() {
        return TermAnalyzer.charNGrams(n);
    }

    @Override
    protected double combine(double queryWeight, double referenceWeight) {
        return Math.min(queryWeight, referenceWeight);
    }

    @Override
    protected double similarity(double overlap, SparseVector query, SparseVector reference) {
        double denominator = query.sum() + reference.sum() - overlap;
        return denominator > 0.0 ? overlap / denominator : 0.0;
    }
}
