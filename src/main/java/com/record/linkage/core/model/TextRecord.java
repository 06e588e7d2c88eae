package com.record.linkage.core.model;

import java.util.Objects;

/**
 * A text value from a source table together with its normalized form.
 * Identity is the row position within the source table.
 */
public record TextRecord(
        int index,
        String original,
        String normalized
) {
    public TextRecord {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        original = original != null ? original : "";
        Objects.requireNonNull(normalized, "normalized is required");
    }

    /**
     * Returns true if nothing is left to compare after normalization.
     */
    public boolean isBlank() {
        return normalized.isEmpty();
    }
}
