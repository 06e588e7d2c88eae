package com.record.linkage.core.model;

/**
 * Shape of the similarity score an algorithm produces.
 */
public enum ScoreKind {
    /**
     * Real number in [0, 1].
     */
    CONTINUOUS,

    /**
     * Either 1.0 (true) or 0.0 (false).
     */
    BOOLEAN
}
