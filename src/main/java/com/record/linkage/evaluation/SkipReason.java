package com.record.linkage.evaluation;

/**
 * Why an algorithm could not be evaluated on a dataset.
 */
public enum SkipReason {
    /** The label or prediction column is absent. */
    MISSING_COLUMNS,
    /** Every row lacks a label or a prediction. */
    NO_LABELLED_ROWS,
    /** A label or prediction is not binary. */
    LABEL_DOMAIN
}
