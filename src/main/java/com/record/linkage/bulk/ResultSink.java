package com.record.linkage.bulk;

import com.record.linkage.matching.MatchingRun;

/**
 * Receives every finished matching run, typically to persist it for validation.
 */
@FunctionalInterface
public interface ResultSink {

    void accept(MatchingRun run);

    /**
     * A sink that discards runs.
     */
    ResultSink DISCARD = run -> {};
}
