package com.record.linkage.evaluation;

import com.record.linkage.core.model.AlgorithmType;

/**
 * Evaluation of one algorithm on one dataset.
 *
 * @param algorithm    the evaluated algorithm
 * @param labelledRows rows that had both a label and a prediction
 * @param matrix       the confusion matrix over those rows
 * @param metrics      metrics derived from the matrix
 */
public record AlgorithmEvaluation(
        AlgorithmType algorithm,
        long labelledRows,
        ConfusionMatrix matrix,
        MetricSet metrics
) {
    public static AlgorithmEvaluation of(AlgorithmType algorithm, ConfusionMatrix matrix) {
        return new AlgorithmEvaluation(algorithm, matrix.total(), matrix, MetricSet.from(matrix));
    }
}
