package com.record.linkage.matching;

import com.record.linkage.core.model.ResultKey;

import java.util.List;

/**
 * Everything one {@link LinkagePipeline#link} call produced.
 *
 * @param runs            finished runs in mapping, then algorithm order
 * @param skippedMappings mappings whose column was missing from either table
 * @param failedRuns      runs that aborted as a whole, e.g. because preparation failed
 */
public record LinkageResult(
        List<MatchingRun> runs,
        List<ColumnMapping> skippedMappings,
        List<RunFailure> failedRuns
) {
    public LinkageResult {
        runs = runs != null ? List.copyOf(runs) : List.of();
        skippedMappings = skippedMappings != null ? List.copyOf(skippedMappings) : List.of();
        failedRuns = failedRuns != null ? List.copyOf(failedRuns) : List.of();
    }

    public boolean hasFailures() {
        return !failedRuns.isEmpty() || runs.stream().anyMatch(MatchingRun::hasFailures);
    }

    /**
     * A run that produced no result table.
     */
    public record RunFailure(ResultKey key, String errorType, String message) {}

    @Override
    public String toString() {
        return "LinkageResult{runs=" + runs.size() +
                ", skippedMappings=" + skippedMappings.size() +
                ", failedRuns=" + failedRuns.size() + '}';
    }
}
