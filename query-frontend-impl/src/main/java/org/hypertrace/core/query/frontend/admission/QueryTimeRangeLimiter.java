package org.hypertrace.core.query.frontend.admission;

import static org.hypertrace.core.query.frontend.util.QueryRequestUtil.getTimeRangeDuration;

import io.grpc.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.QueryMiddleware;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.limits.LimitsSource;
import org.hypertrace.core.query.frontend.limits.TenantLimits;
import org.hypertrace.core.query.frontend.merge.QueryResponseMerger;

/**
 * Applies the tenant's lookback and length limits to the query range. Data older than the
 * lookback is never queried: the start is moved up to the lookback boundary, and a range ending
 * before it is answered with an empty result. Ranges longer than the max query length are
 * rejected.
 */
@Slf4j
@Singleton
public class QueryTimeRangeLimiter implements QueryMiddleware {
  public static final String NAME = "query-time-range";

  private final LimitsSource limitsSource;
  private final Clock clock;
  private final Counter rejectionCounter;

  @Inject
  public QueryTimeRangeLimiter(
      LimitsSource limitsSource, Clock clock, MeterRegistry meterRegistry) {
    this.limitsSource = limitsSource;
    this.clock = clock;
    this.rejectionCounter = AdmissionMetrics.rejectionCounter(meterRegistry, NAME);
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public QueryHandler wrap(QueryHandler next) {
    return (context, request) -> {
      TenantLimits limits = this.limitsSource.forRequest(context);
      Instant start = request.getStart();
      Duration lookback = limits.getMaxQueryLookback();
      if (!lookback.isZero()) {
        Instant oldest = this.clock.instant().minus(lookback);
        if (request.getEnd().isBefore(oldest)) {
          log.debug(
              "Query {} ends before the {} lookback of tenant {}, answering empty",
              request.getQuery(),
              lookback,
              context.getTenantId());
          return Single.just(QueryResponse.empty(QueryResponseMerger.resultTypeOf(request)));
        }
        if (start.isBefore(oldest)) {
          start = oldest;
        }
      }

      QueryRequest clamped =
          start.equals(request.getStart())
              ? request
              : request.withTimeRange(start, request.getEnd());
      Duration maxLength = limits.getMaxQueryLength();
      Duration length = getTimeRangeDuration(clamped);
      if (!maxLength.isZero() && length.compareTo(maxLength) > 0) {
        this.rejectionCounter.increment();
        return Single.error(
            Status.INVALID_ARGUMENT
                .withDescription(
                    String.format(
                        "the query time range exceeds the limit (query length: %s, limit: %s)",
                        length, maxLength))
                .asException());
      }

      return next.handle(context, clamped);
    };
  }
}
