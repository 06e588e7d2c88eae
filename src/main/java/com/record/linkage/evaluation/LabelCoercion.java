package com.record.linkage.evaluation;

import java.util.Locale;
import java.util.Set;

/**
 * Reads binary labels from text cells as reviewers and exporters write them.
 * Accepted, case-insensitively: {@code 1/0}, {@code 1.0/0.0}, {@code true/false}, {@code yes/no}, {@code y/n}.
 */
public final class LabelCoercion {

    private static final Set<String> TRUE_VALUES = Set.of("1", "1.0", "true", "yes", "y");
    private static final Set<String> FALSE_VALUES = Set.of("0", "0.0", "false", "no", "n");

    private LabelCoercion() {
    }

    public static boolean isMissing(String cell) {
        return cell == null || cell.isBlank();
    }

    /**
     * Returns the label, or {@code null} for a missing or blank cell.
     *
     * @throws LabelDomainException if the cell holds any other value
     */
    public static Boolean coerce(String column, String cell) {
        if (isMissing(cell)) {
            return null;
        }
        String value = cell.strip().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(value)) return Boolean.TRUE;
        if (FALSE_VALUES.contains(value)) return Boolean.FALSE;
        throw new LabelDomainException(column, cell);
    }
}
