package com.record.linkage.metrics;

import com.record.linkage.core.model.AlgorithmType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchingDuration(AlgorithmType algorithm, Duration duration) {
    }

    @Override
    public void incrementQueryMatched(AlgorithmType algorithm) {
    }

    @Override
    public void incrementQueryFailed(AlgorithmType algorithm) {
    }

    @Override
    public void incrementMatchAccepted(AlgorithmType algorithm) {
    }

    @Override
    public void recordSimilarityScore(AlgorithmType algorithm, double score) {
    }

    @Override
    public void incrementEvaluationSkipped(String dataset, String reason) {
    }
}
