package com.record.linkage.similarity;

import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.MatchingState;
import com.record.linkage.core.model.TextRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared lifecycle for matching algorithms: input bookkeeping, state transitions,
 * empty-input handling and thresholding. Subclasses only implement the search itself.
 */
public abstract class AbstractMatchingAlgorithm implements MatchingAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(AbstractMatchingAlgorithm.class);

    private volatile MatchingState state = MatchingState.UNPREPARED;
    private List<TextRecord> reference = List.of();
    private List<TextRecord> queries = List.of();

    @Override
    public MatchingState state() {
        return state;
    }

    @Override
    public final void prepare(List<TextRecord> reference, List<TextRecord> queries) {
        Objects.requireNonNull(reference, "reference is required");
        Objects.requireNonNull(queries, "queries is required");
        this.reference = List.copyOf(reference);
        this.queries = List.copyOf(queries);

        if (this.reference.isEmpty()) {
            log.warn("prepare.emptyCorpus algorithm={} queries={} - every query reports no match",
                    type(), this.queries.size());
        }
        if (this.queries.isEmpty()) {
            log.warn("prepare.emptyQueries algorithm={} references={}", type(), this.reference.size());
        }

        prepareStructures(this.reference, this.queries);
        state = MatchingState.PREPARED;
        log.debug("prepare.completed algorithm={} references={} queries={}",
                type(), this.reference.size(), this.queries.size());
    }

    @Override
    public int queryCount() {
        return queries.size();
    }

    @Override
    public MatchResult findMatch(int queryPosition) {
        requirePrepared();
        TextRecord query = queries.get(queryPosition);
        if (query.isBlank() || reference.isEmpty()) {
            return MatchResult.noMatch(query);
        }
        return search(query, queryPosition);
    }

    @Override
    public List<MatchResult> findMatches() {
        requirePrepared();
        List<MatchResult> results = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            results.add(findMatch(i));
        }
        completeSearch();
        return results;
    }

    @Override
    public void completeSearch() {
        requirePrepared();
        state = MatchingState.SEARCHED;
    }

    @Override
    public List<MatchResult> classify(List<MatchResult> results, double threshold) {
        if (state != MatchingState.SEARCHED && state != MatchingState.CLASSIFIED) {
            throw new IllegalStateException(type() + " must finish searching before classifying, state " + state);
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        List<MatchResult> classified = new ArrayList<>(results.size());
        for (MatchResult result : results) {
            boolean accepted = result.score() != null && result.score() >= threshold;
            classified.add(result.withAccepted(accepted));
        }
        state = MatchingState.CLASSIFIED;
        return classified;
    }

    /**
     * Returns the prepared reference corpus.
     */
    protected List<TextRecord> reference() {
        return reference;
    }

    /**
     * Returns the prepared query set.
     */
    protected List<TextRecord> queries() {
        return queries;
    }

    /**
     * Builds per-run working structures. Called once per {@link #prepare} with immutable copies.
     */
    protected void prepareStructures(List<TextRecord> reference, List<TextRecord> queries) {
    }

    /**
     * Searches the corpus for one non-blank query. The corpus is never empty here.
     * Must not modify shared state.
     */
    protected abstract MatchResult search(TextRecord query, int queryPosition);

    private void requirePrepared() {
        if (state == MatchingState.UNPREPARED) {
            throw new IllegalStateException(type() + " must be prepared before searching");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{state=" + state +
                ", references=" + reference.size() +
                ", queries=" + queries.size() + '}';
    }
}
