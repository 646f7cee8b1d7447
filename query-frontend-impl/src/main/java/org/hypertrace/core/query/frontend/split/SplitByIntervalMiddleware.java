package org.hypertrace.core.query.frontend.split;

import java.time.Duration;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.QueryFrontendConfig;
import org.hypertrace.core.query.frontend.QueryMiddleware;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.execution.BoundedConcurrentExecutor;
import org.hypertrace.core.query.frontend.limits.LimitsSource;
import org.hypertrace.core.query.frontend.limits.TenantLimits;
import org.hypertrace.core.query.frontend.merge.QueryResponseMerger;
import org.hypertrace.core.query.frontend.parallelism.WeightedParallelism;

/**
 * Splits a query into interval aligned sub-queries, runs them downstream with the parallelism the
 * spanned schema periods allow, and merges the results back in order.
 */
@Slf4j
@Singleton
public class SplitByIntervalMiddleware implements QueryMiddleware {
  public static final String NAME = "split-by-interval";

  private final LimitsSource limitsSource;
  private final QuerySplitter querySplitter;
  private final WeightedParallelism weightedParallelism;
  private final BoundedConcurrentExecutor executor;
  private final QueryResponseMerger responseMerger;
  private final Duration defaultSplitInterval;

  @Inject
  SplitByIntervalMiddleware(
      QueryFrontendConfig config,
      LimitsSource limitsSource,
      QuerySplitter querySplitter,
      WeightedParallelism weightedParallelism,
      BoundedConcurrentExecutor executor,
      QueryResponseMerger responseMerger) {
    this(
        limitsSource,
        querySplitter,
        weightedParallelism,
        executor,
        responseMerger,
        config.getDefaultSplitInterval());
  }

  public SplitByIntervalMiddleware(
      LimitsSource limitsSource,
      QuerySplitter querySplitter,
      WeightedParallelism weightedParallelism,
      BoundedConcurrentExecutor executor,
      QueryResponseMerger responseMerger,
      Duration defaultSplitInterval) {
    this.limitsSource = limitsSource;
    this.querySplitter = querySplitter;
    this.weightedParallelism = weightedParallelism;
    this.executor = executor;
    this.responseMerger = responseMerger;
    this.defaultSplitInterval = defaultSplitInterval;
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public QueryHandler wrap(QueryHandler next) {
    return (context, request) -> {
      TenantLimits limits = this.limitsSource.forRequest(context);
      Duration interval =
          limits.getSplitQueriesByInterval().isZero()
              ? this.defaultSplitInterval
              : limits.getSplitQueriesByInterval();
      List<QueryRequest> subRequests = this.querySplitter.split(request, interval);
      int parallelism =
          this.weightedParallelism.calculate(limits, request.getStart(), request.getEnd());
      log.debug(
          "Split query {} into {} sub-queries of {}, parallelism {}",
          request.getQuery(),
          subRequests.size(),
          interval,
          parallelism);
      return this.executor
          .execute(context, subRequests, parallelism, next)
          .map(responses -> this.responseMerger.merge(request, responses));
    };
  }
}
