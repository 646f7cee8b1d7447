package org.hypertrace.core.query.frontend.admission;

import io.grpc.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Single;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.QueryMiddleware;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.RequestScopedKey;
import org.hypertrace.core.query.frontend.limits.LimitsSource;

/**
 * Fails a query once the distinct label sets returned for it exceed the tenant's series limit.
 * The seen set is kept per top-level request, so behind the splitter every sub-query adds to the
 * same count and the first sub-response crossing the limit fails the whole query.
 */
@Slf4j
@Singleton
public class SeriesLimiter implements QueryMiddleware {
  public static final String NAME = "series-limit";
  private static final RequestScopedKey<Set<Map<String, String>>> SEEN_SERIES =
      RequestScopedKey.named("series-limit.seen");

  private final LimitsSource limitsSource;
  private final Counter rejectionCounter;

  @Inject
  public SeriesLimiter(LimitsSource limitsSource, MeterRegistry meterRegistry) {
    this.limitsSource = limitsSource;
    this.rejectionCounter = AdmissionMetrics.rejectionCounter(meterRegistry, NAME);
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public QueryHandler wrap(QueryHandler next) {
    return (context, request) -> {
      int maxSeries = this.limitsSource.forRequest(context).getMaxQuerySeries();
      if (maxSeries <= 0) {
        return next.handle(context, request);
      }
      Set<Map<String, String>> seen =
          context.computeIfAbsent(SEEN_SERIES, ConcurrentHashMap::newKeySet);
      return next.handle(context, request)
          .flatMap(
              response -> {
                seen.addAll(response.labelSets());
                if (seen.size() > maxSeries) {
                  this.rejectionCounter.increment();
                  log.warn(
                      "Rejecting query {} for tenant {}: more than {} series",
                      request.getQuery(),
                      context.getTenantId(),
                      maxSeries);
                  return Single.error(
                      Status.INVALID_ARGUMENT
                          .withDescription(
                              String.format(
                                  "maximum of series (%d) reached for a single query", maxSeries))
                          .asException());
                }
                return Single.just(response);
              });
    };
  }
}
