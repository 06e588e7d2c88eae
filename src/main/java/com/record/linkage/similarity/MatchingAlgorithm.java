package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.MatchingState;
import com.record.linkage.core.model.TextRecord;

import java.util.List;

/**
 * Best-match search over a reference corpus.
 *
 * <p>Lifecycle: {@code prepare → findMatches → classify}. {@link #prepare} may be called again with new
 * inputs and resets the instance to {@link MatchingState#PREPARED}. An instance is not safe for concurrent
 * {@code prepare} calls; once prepared, {@link #findMatch(int)} is read-only and may be called from many
 * threads at the same time.</p>
 */
public interface MatchingAlgorithm {

    /**
     * Returns the algorithm implemented by this instance.
     */
    AlgorithmType type();

    /**
     * Returns the current lifecycle state.
     */
    MatchingState state();

    /**
     * Builds the working structures for one corpus/query pair.
     * An empty corpus does not fail; every query then reports no match.
     */
    void prepare(List<TextRecord> reference, List<TextRecord> queries);

    /**
     * Returns the number of prepared queries.
     */
    int queryCount();

    /**
     * Finds the best reference for the query at the given position.
     *
     * @throws IllegalStateException     if the instance has not been prepared
     * @throws IndexOutOfBoundsException if the position is outside the query set
     */
    MatchResult findMatch(int queryPosition);

    /**
     * Finds the best reference for every query, in query input order.
     */
    List<MatchResult> findMatches();

    /**
     * Moves the instance to {@link MatchingState#SEARCHED} once every query went through {@link #findMatch(int)}.
     * {@link #findMatches()} does this itself.
     *
     * @throws IllegalStateException if the instance has not been prepared
     */
    void completeSearch();

    /**
     * Sets the accepted flag of every result: {@code score >= threshold}. Absent scores are not accepted.
     *
     * @throws IllegalStateException if no search has completed since the last {@link #prepare}
     */
    List<MatchResult> classify(List<MatchResult> results, double threshold);
}
