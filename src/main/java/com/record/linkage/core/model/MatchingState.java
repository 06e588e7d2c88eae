package com.record.linkage.core.model;

/**
 * Lifecycle of a matching algorithm instance.
 * Transitions only move forward; a new {@code prepare} resets to {@link #PREPARED}.
 */
public enum MatchingState {
    UNPREPARED,
    PREPARED,
    SEARCHED,
    CLASSIFIED
}
