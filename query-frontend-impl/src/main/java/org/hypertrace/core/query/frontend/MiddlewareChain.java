package org.hypertrace.core.query.frontend;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.api.QueryHandler;

/**
 * Middlewares in configured order, the first name being the outermost. Every configured name must
 * resolve to a registered middleware.
 */
@Slf4j
@Singleton
public class MiddlewareChain {
  private final List<QueryMiddleware> middlewares;

  @Inject
  MiddlewareChain(QueryFrontendConfig config, Set<QueryMiddleware> registeredMiddlewares) {
    this(config.getMiddlewareNames(), registeredMiddlewares);
  }

  MiddlewareChain(List<String> names, Set<QueryMiddleware> registeredMiddlewares) {
    Map<String, QueryMiddleware> middlewaresByName =
        registeredMiddlewares.stream()
            .collect(Collectors.toMap(QueryMiddleware::getName, Function.identity()));
    this.middlewares =
        names.stream()
            .map(
                name -> {
                  QueryMiddleware middleware = middlewaresByName.get(name);
                  if (middleware == null) {
                    throw new UnsupportedOperationException(
                        "No middleware registered matching configured name: " + name);
                  }
                  return middleware;
                })
            .collect(Collectors.toUnmodifiableList());
    log.info("Query middleware chain: {}", names);
  }

  /** Composes the chain in front of {@code terminal}. */
  public QueryHandler wrap(QueryHandler terminal) {
    QueryHandler handler = terminal;
    for (int i = this.middlewares.size() - 1; i >= 0; i--) {
      handler = this.middlewares.get(i).wrap(handler);
    }
    return handler;
  }

  public List<String> getNames() {
    return this.middlewares.stream()
        .map(QueryMiddleware::getName)
        .collect(Collectors.toUnmodifiableList());
  }
}
