package com.record.linkage.matching;

/**
 * A query whose search failed. The query is left out of the result table and reported here instead.
 *
 * @param queryIndex row index of the query in its source table
 * @param query      the original query text
 * @param errorType  simple class name of the failure
 * @param message    the failure message
 */
public record QueryFailure(int queryIndex, String query, String errorType, String message) {

    static QueryFailure of(int queryIndex, String query, Throwable error) {
        return new QueryFailure(queryIndex, query, error.getClass().getSimpleName(), error.getMessage());
    }
}
