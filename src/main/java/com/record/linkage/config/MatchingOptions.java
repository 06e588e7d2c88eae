package com.record.linkage.config;

import com.record.linkage.core.model.AlgorithmType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Process-wide options for matching runs.
 * Configures the acceptance threshold of each algorithm, the worker pool size and the n-gram length.
 */
public class MatchingOptions {

    private static final int MAX_POOL_SIZE = 32;
    private static final int POOL_HEADROOM = 4;
    private static final int DEFAULT_NGRAM_SIZE = 2;

    private final Map<AlgorithmType, Double> thresholds;
    private final int maxWorkers;
    private final int ngramSize;

    private MatchingOptions(Builder builder) {
        this.thresholds = Collections.unmodifiableMap(new EnumMap<>(builder.thresholds));
        this.maxWorkers = builder.maxWorkers;
        this.ngramSize = builder.ngramSize;
    }

    /**
     * Returns the acceptance threshold for the given algorithm.
     */
    public double getThreshold(AlgorithmType algorithm) {
        return thresholds.get(algorithm);
    }

    public Map<AlgorithmType, Double> getThresholds() {
        return thresholds;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getNgramSize() {
        return ngramSize;
    }

    /**
     * Creates default options.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Worker count used when none is configured: {@code min(32, cpus + 4)}.
     */
    public static int defaultMaxWorkers() {
        return Math.min(MAX_POOL_SIZE, Runtime.getRuntime().availableProcessors() + POOL_HEADROOM);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with these options.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.thresholds.putAll(thresholds);
        builder.maxWorkers = maxWorkers;
        builder.ngramSize = ngramSize;
        return builder;
    }

    public static class Builder {
        private final Map<AlgorithmType, Double> thresholds = new EnumMap<>(AlgorithmType.class);
        private int maxWorkers = defaultMaxWorkers();
        private int ngramSize = DEFAULT_NGRAM_SIZE;

        private Builder() {
            for (AlgorithmType type : AlgorithmType.values()) {
                thresholds.put(type, type.getDefaultThreshold());
            }
        }

        public Builder threshold(AlgorithmType algorithm, double threshold) {
            if (algorithm == null) {
                throw new IllegalArgumentException("algorithm must not be null");
            }
            validateThreshold(threshold, algorithm.getExportName());
            thresholds.put(algorithm, threshold);
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            if (maxWorkers <= 0) {
                throw new IllegalArgumentException("maxWorkers must be positive");
            }
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder ngramSize(int ngramSize) {
            if (ngramSize <= 0) {
                throw new IllegalArgumentException("ngramSize must be positive");
            }
            this.ngramSize = ngramSize;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " threshold must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "thresholds=" + thresholds +
                ", maxWorkers=" + maxWorkers +
                ", ngramSize=" + ngramSize +
                '}';
    }
}
