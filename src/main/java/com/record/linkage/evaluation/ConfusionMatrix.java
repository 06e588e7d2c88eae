package com.record.linkage.evaluation;

import java.util.List;

/**
 * Counts of a binary classification against ground truth.
 */
public record ConfusionMatrix(long trueNegatives, long falsePositives, long falseNegatives, long truePositives) {

    public ConfusionMatrix {
        if (trueNegatives < 0 || falsePositives < 0 || falseNegatives < 0 || truePositives < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
    }

    /**
     * Tallies paired labels. Both lists must have the same size and contain no {@code null}.
     */
    public static ConfusionMatrix of(List<Boolean> actual, List<Boolean> predicted) {
        if (actual.size() != predicted.size()) {
            throw new IllegalArgumentException("Label lists differ in size: "
                    + actual.size() + " vs " + predicted.size());
        }
        long tn = 0, fp = 0, fn = 0, tp = 0;
        for (int i = 0; i < actual.size(); i++) {
            boolean a = actual.get(i);
            boolean p = predicted.get(i);
            if (a && p) tp++;
            else if (a) fn++;
            else if (p) fp++;
            else tn++;
        }
        return new ConfusionMatrix(tn, fp, fn, tp);
    }

    public long total() {
        return trueNegatives + falsePositives + falseNegatives + truePositives;
    }

    public long actualPositives() {
        return truePositives + falseNegatives;
    }

    public long actualNegatives() {
        return trueNegatives + falsePositives;
    }

    /**
     * Returns the matrix as {@code [[tn, fp], [fn, tp]]}: rows are the actual class, columns the prediction.
     */
    public long[][] toArray() {
        return new long[][]{{trueNegatives, falsePositives}, {falseNegatives, truePositives}};
    }
}
