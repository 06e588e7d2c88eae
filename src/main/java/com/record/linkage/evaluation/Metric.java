package com.record.linkage.evaluation;

/**
 * The classification metrics reported per algorithm, in report order.
 */
public enum Metric {
    ACCURACY("Accuracy"),
    PRECISION("Precision"),
    RECALL("Recall"),
    F1_SCORE("F1-Score"),
    ROC_AUC("ROC-AUC");

    private final String displayName;

    Metric(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
