package com.record.linkage.bulk;

/**
 * Result of exporting one matching run.
 *
 * @param target        where the rows went (file path or "stream")
 * @param rowsWritten   number of data rows written, header excluded
 * @param failedQueries number of failed queries that had no row to write
 */
public record ExportResult(
        String target,
        long rowsWritten,
        long failedQueries
) {
    @Override
    public String toString() {
        return "ExportResult{target=" + target +
                ", rows=" + rowsWritten +
                ", failed=" + failedQueries + '}';
    }
}
