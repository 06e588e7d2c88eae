package com.record.linkage.matching;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.ResultKey;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one matching run: the classified result table in query order plus the queries that failed.
 * {@code results.size() + failures.size()} equals the number of queries.
 */
public record MatchingRun(
        ResultKey key,
        double threshold,
        List<MatchResult> results,
        List<QueryFailure> failures,
        Duration duration
) {
    public MatchingRun {
        results = results != null ? List.copyOf(results) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    public AlgorithmType algorithm() {
        return key.algorithm();
    }

    public int queryCount() {
        return results.size() + failures.size();
    }

    public long acceptedCount() {
        return results.stream().filter(MatchResult::isAccepted).count();
    }

    public long matchedCount() {
        return results.stream().filter(MatchResult::hasMatch).count();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "MatchingRun{key=" + key +
                ", results=" + results.size() +
                ", accepted=" + acceptedCount() +
                ", failures=" + failures.size() +
                ", duration=" + duration.toMillis() + "ms}";
    }
}
