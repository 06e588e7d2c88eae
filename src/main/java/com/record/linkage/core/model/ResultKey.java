package com.record.linkage.core.model;

import java.util.Objects;

/**
 * Stable key correlating an exported result table with its validated copy:
 * input source, compared column and algorithm.
 */
public record ResultKey(
        String sourceName,
        String column,
        AlgorithmType algorithm
) {
    private static final int SOURCE_PREFIX_LENGTH = 13;

    public ResultKey {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Objects.requireNonNull(column, "column is required");
        Objects.requireNonNull(algorithm, "algorithm is required");
    }

    /**
     * File-name friendly form: {@code <source prefix>_<column>_<ALGORITHM>}.
     * Source names are usually long content hashes, so only their first 13 characters are kept.
     */
    public String fileStem() {
        String prefix = sourceName.length() > SOURCE_PREFIX_LENGTH
                ? sourceName.substring(0, SOURCE_PREFIX_LENGTH)
                : sourceName;
        return prefix + "_" + column + "_" + algorithm.getExportName();
    }

    @Override
    public String toString() {
        return sourceName + "/" + column + "/" + algorithm.getExportName();
    }
}
