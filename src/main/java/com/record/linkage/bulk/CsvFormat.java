package com.record.linkage.bulk;

/**
 * Shared CSV conventions: semicolon delimiter, double-quote quoting with doubled quotes as escape.
 */
final class CsvFormat {

    static final char DEFAULT_DELIMITER = ';';
    static final char QUOTE = '"';

    private CsvFormat() {
    }

    /**
     * Escapes one cell. {@code null} is written as an empty unquoted cell.
     */
    static String escape(String value, char delimiter) {
        if (value == null) return "";
        if (value.isEmpty()) return "\"\"";
        if (value.indexOf(delimiter) >= 0 || value.indexOf(QUOTE) >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return QUOTE + value.replace("\"", "\"\"") + QUOTE;
        }
        return value;
    }
}
