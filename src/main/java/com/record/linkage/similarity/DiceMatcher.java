package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;

/**
 * Dice coefficient on character bigram counts: 2·|q ∩ r| / (|q| + |r|).
 * Intersections are multiset intersections (minimum count per bigram).
 */
public class DiceMatcher extends AbstractVectorMatchingAlgorithm {

    private static final int BIGRAM = 2;

    @Override
    public AlgorithmType type() {
        return AlgorithmType.DICE;
    }

    @Override
    protected TermAnalyzer analyzer() {
        return TermAnalyzer.charNGrams(BIGRAM);
    }

    @Override
    protected double combine(double queryWeight, double referenceWeight) {
        return Math.min(queryWeight, referenceWeight);
    }

    @Override
    protected double similarity(double overlap, SparseVector query, SparseVector reference) {
        double denominator = query.sum() + reference.sum();
        return denominator > 0.0 ? 2.0 * overlap / denominator : 0.0;
    }
}
