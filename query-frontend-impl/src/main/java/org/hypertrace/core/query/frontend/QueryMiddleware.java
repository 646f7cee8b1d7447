package org.hypertrace.core.query.frontend;

import org.hypertrace.core.query.frontend.api.QueryHandler;

/**
 * A named stage of the query path. Middlewares are registered with Guice and ordered by the
 * {@code middlewares} configuration list.
 */
public interface QueryMiddleware {

  /** The name used to reference this middleware from configuration. */
  String getName();

  /** Returns a handler running this middleware in front of {@code next}. */
  QueryHandler wrap(QueryHandler next);
}
