package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;

/**
 * Token-set overlap: |q ∩ r| / |q ∪ r| over binary bag-of-words vectors.
 */
public class JaccardMatcher extends AbstractVectorMatchingAlgorithm {

    @Override
    public AlgorithmType type() {
        return AlgorithmType.JACCARD;
    }

    @Override
    protected TermAnalyzer analyzer() {
        return TermAnalyzer.words();
    }

    @Override
    protected boolean binaryCounts() {
        return true;
    }

    @Override
    protected double combine(double queryWeight, double referenceWeight) {
        return Math.min(queryWeight, referenceWeight);
    }

    @Override
    protected double similarity(double overlap, SparseVector query, SparseVector reference) {
        double union = query.sum() + reference.sum() - overlap;
        return union > 0.0 ? overlap / union : 0.0;
    }
}
