package com.record.linkage.metrics;

import com.record.linkage.core.model.AlgorithmType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.matching.duration} - Timer (tag: algorithm)</li>
 *   <li>{@code linkage.query.matched} - Counter (tag: algorithm)</li>
 *   <li>{@code linkage.query.failed} - Counter (tag: algorithm)</li>
 *   <li>{@code linkage.match.accepted} - Counter (tag: algorithm)</li>
 *   <li>{@code linkage.similarity.score} - DistributionSummary (tag: algorithm)</li>
 *   <li>{@code linkage.evaluation.skipped} - Counter (tags: dataset, reason)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordMatchingDuration(AlgorithmType algorithm, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(algorithm.name(), k ->
                Timer.builder("linkage.matching.duration")
                        .description("Duration of one matching run")
                        .tag("algorithm", algorithm.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementQueryMatched(AlgorithmType algorithm) {
        algorithmCounter("linkage.query.matched", "Number of queries searched successfully", algorithm)
                .increment();
    }

    @Override
    public void incrementQueryFailed(AlgorithmType algorithm) {
        algorithmCounter("linkage.query.failed", "Number of queries whose search failed", algorithm)
                .increment();
    }

    @Override
    public void incrementMatchAccepted(AlgorithmType algorithm) {
        algorithmCounter("linkage.match.accepted", "Number of best matches above threshold", algorithm)
                .increment();
    }

    @Override
    public void recordSimilarityScore(AlgorithmType algorithm, double score) {
        DistributionSummary summary = summaryCache.computeIfAbsent(algorithm.name(), k ->
                DistributionSummary.builder("linkage.similarity.score")
                        .description("Distribution of best-match similarity scores")
                        .tag("algorithm", algorithm.name())
                        .register(registry));
        summary.record(score);
    }

    @Override
    public void incrementEvaluationSkipped(String dataset, String reason) {
        String key = "skipped:" + dataset + ":" + reason;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("linkage.evaluation.skipped")
                        .description("Number of algorithm/dataset pairs skipped during evaluation")
                        .tag("dataset", dataset)
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    private Counter algorithmCounter(String name, String description, AlgorithmType algorithm) {
        String key = name + ":" + algorithm.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("algorithm", algorithm.name())
                        .register(registry));
    }
}
