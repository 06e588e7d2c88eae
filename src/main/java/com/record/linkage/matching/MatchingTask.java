package com.record.linkage.matching;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.ResultKey;
import com.record.linkage.core.model.TextRecord;

import java.util.List;
import java.util.Objects;

/**
 * One unit of matching work: a normalized corpus and query set, compared with the algorithm named in the key.
 */
public record MatchingTask(
        ResultKey key,
        List<TextRecord> reference,
        List<TextRecord> queries
) {
    public MatchingTask {
        Objects.requireNonNull(key, "key is required");
        reference = reference != null ? List.copyOf(reference) : List.of();
        queries = queries != null ? List.copyOf(queries) : List.of();
    }

    public AlgorithmType algorithm() {
        return key.algorithm();
    }
}
