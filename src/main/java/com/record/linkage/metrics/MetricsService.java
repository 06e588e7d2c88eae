package com.record.linkage.metrics;

import com.record.linkage.core.model.AlgorithmType;

import java.time.Duration;

/**
 * Interface for recording matching and evaluation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a meter registry.
 */
public interface MetricsService {

    void recordMatchingDuration(AlgorithmType algorithm, Duration duration);

    void incrementQueryMatched(AlgorithmType algorithm);

    void incrementQueryFailed(AlgorithmType algorithm);

    void incrementMatchAccepted(AlgorithmType algorithm);

    void recordSimilarityScore(AlgorithmType algorithm, double score);

    void incrementEvaluationSkipped(String dataset, String reason);
}
