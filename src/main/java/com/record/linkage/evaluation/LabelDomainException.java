package com.record.linkage.evaluation;

/**
 * Thrown when a label cell holds a value that is not a recognizable boolean.
 */
public class LabelDomainException extends RuntimeException {

    private final String column;
    private final String value;

    public LabelDomainException(String column, String value) {
        super("Column " + column + " holds non-binary label '" + value + "'");
        this.column = column;
        this.value = value;
    }

    public String getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }
}
