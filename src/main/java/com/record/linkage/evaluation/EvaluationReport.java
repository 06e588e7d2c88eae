package com.record.linkage.evaluation;

import com.record.linkage.core.model.AlgorithmType;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Metrics of every evaluated algorithm on one dataset, plus the algorithms that were skipped.
 */
public record EvaluationReport(
        String datasetName,
        List<AlgorithmEvaluation> evaluations,
        List<SkippedEvaluation> skipped
) {
    public EvaluationReport {
        evaluations = evaluations != null ? List.copyOf(evaluations) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }

    /**
     * Returns true if no algorithm could be evaluated.
     */
    public boolean isEmpty() {
        return evaluations.isEmpty();
    }

    public Optional<AlgorithmEvaluation> find(AlgorithmType algorithm) {
        return evaluations.stream().filter(e -> e.algorithm() == algorithm).findFirst();
    }

    /**
     * Returns the metrics table: one row per metric, one column per evaluated algorithm in evaluation order.
     */
    public Map<Metric, Map<AlgorithmType, Double>> metricsTable() {
        Map<Metric, Map<AlgorithmType, Double>> table = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            Map<AlgorithmType, Double> row = new LinkedHashMap<>();
            for (AlgorithmEvaluation evaluation : evaluations) {
                row.put(evaluation.algorithm(), evaluation.metrics().get(metric));
            }
            table.put(metric, row);
        }
        return table;
    }

    @Override
    public String toString() {
        return "EvaluationReport{dataset=" + datasetName +
                ", evaluated=" + evaluations.size() +
                ", skipped=" + skipped.size() + '}';
    }
}
