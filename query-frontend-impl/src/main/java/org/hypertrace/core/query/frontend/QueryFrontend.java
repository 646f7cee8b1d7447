package org.hypertrace.core.query.frontend;

import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Single;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.cache.CacheKeyGenerator;
import org.hypertrace.core.query.frontend.limits.ConfigLimitsSource;
import org.hypertrace.core.query.frontend.limits.ReloadableLimitsSource;
import org.hypertrace.core.query.frontend.validation.QueryValidator;

/**
 * Entry point of the query path: validates a request, then runs it through the configured
 * middleware chain in front of the downstream handler.
 */
@Singleton
@Slf4j
public class QueryFrontend {
  private static final String FRONTEND_REQUESTS_STATUS_COUNTER =
      "hypertrace.query.frontend.requests.status";

  private final QueryValidator queryValidator;
  private final QueryHandler handler;
  private final CacheKeyGenerator cacheKeyGenerator;
  private final ReloadableLimitsSource limitsSource;
  private final Counter requestStatusErrorCounter;
  private final Counter requestStatusSuccessCounter;

  @Inject
  QueryFrontend(
      QueryValidator queryValidator,
      MiddlewareChain middlewareChain,
      QueryHandler downstreamHandler,
      CacheKeyGenerator cacheKeyGenerator,
      ReloadableLimitsSource limitsSource,
      MeterRegistry meterRegistry) {
    this.queryValidator = queryValidator;
    this.handler = middlewareChain.wrap(downstreamHandler);
    this.cacheKeyGenerator = cacheKeyGenerator;
    this.limitsSource = limitsSource;
    this.requestStatusErrorCounter =
        Counter.builder(FRONTEND_REQUESTS_STATUS_COUNTER)
            .tag("error", "true")
            .register(meterRegistry);
    this.requestStatusSuccessCounter =
        Counter.builder(FRONTEND_REQUESTS_STATUS_COUNTER)
            .tag("error", "false")
            .register(meterRegistry);
  }

  /** Executes a request for the tenant, cancelled along with the current gRPC context. */
  public Single<QueryResponse> execute(String tenantId, QueryRequest request) {
    return this.execute(QueryContext.forTenant(tenantId), request);
  }

  public Single<QueryResponse> execute(QueryContext queryContext, QueryRequest request) {
    return this.queryValidator
        .validate(request, queryContext)
        .andThen(Single.defer(() -> this.handler.handle(queryContext, request)))
        .doOnError(
            error -> {
              log.error("Query failed: {}", request, error);
              requestStatusErrorCounter.increment();
            })
        .doOnSuccess(response -> requestStatusSuccessCounter.increment());
  }

  public String cacheKey(String tenantId, QueryRequest request) {
    return this.cacheKeyGenerator.generate(tenantId, request);
  }

  /** Replaces the tenant limits; requests already running keep the limits they started with. */
  public void reloadLimits(Config limitsConfig) {
    this.limitsSource.reload(new ConfigLimitsSource(limitsConfig));
  }
}
