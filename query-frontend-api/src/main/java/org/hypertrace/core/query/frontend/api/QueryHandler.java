package org.hypertrace.core.query.frontend.api;

import io.reactivex.rxjava3.core.Single;

/**
 * Anything that can answer a query: the downstream query engine, or a middleware wrapping the
 * next handler of the chain.
 */
@FunctionalInterface
public interface QueryHandler {

  Single<QueryResponse> handle(QueryContext context, QueryRequest request);
}
