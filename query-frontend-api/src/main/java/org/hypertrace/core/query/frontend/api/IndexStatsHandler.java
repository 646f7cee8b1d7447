package org.hypertrace.core.query.frontend.api;

import io.reactivex.rxjava3.core.Single;

/**
 * Cheap statistics lookup used to estimate the cost of a query before running it. The request's
 * query is a single stream selector.
 */
@FunctionalInterface
public interface IndexStatsHandler {

  Single<IndexStats> stats(QueryContext context, QueryRequest request);
}
