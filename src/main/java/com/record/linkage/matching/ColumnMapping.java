package com.record.linkage.matching;

import java.util.Objects;

/**
 * Pairs a column of the reference table with the column of the query table it is compared against.
 * Results are keyed by the reference column.
 */
public record ColumnMapping(String referenceColumn, String queryColumn) {

    public ColumnMapping {
        Objects.requireNonNull(referenceColumn, "referenceColumn is required");
        Objects.requireNonNull(queryColumn, "queryColumn is required");
    }

    /**
     * Maps a column onto the column of the same name in the other table.
     */
    public static ColumnMapping same(String column) {
        return new ColumnMapping(column, column);
    }

    @Override
    public String toString() {
        return referenceColumn.equals(queryColumn) ? referenceColumn : referenceColumn + "->" + queryColumn;
    }
}
