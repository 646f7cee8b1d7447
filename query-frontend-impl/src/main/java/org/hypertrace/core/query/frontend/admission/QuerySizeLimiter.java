package org.hypertrace.core.query.frontend.admission;

import static org.hypertrace.core.query.frontend.util.QueryRequestUtil.latest;

import io.grpc.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.QueryMiddleware;
import org.hypertrace.core.query.frontend.api.IndexStatsHandler;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.limits.LimitsSource;
import org.hypertrace.core.query.frontend.limits.TenantLimits;
import org.hypertrace.core.query.frontend.matchers.MatcherGroup;
import org.hypertrace.core.query.frontend.matchers.MatcherGroupExtractor;
import org.hypertrace.core.query.frontend.schema.IndexType;
import org.hypertrace.core.query.frontend.schema.SchemaTimeline;

/**
 * Rejects queries whose matcher groups would read more bytes than the tenant allows, based on
 * index statistics fetched before the query runs. Registered twice: once in front of the splitter
 * against the whole query, once behind it against every sub-query a single querier executes.
 *
 * <p>Statistics are only available from TSDB periods, so ranges that touch no TSDB period are
 * let through unchecked.
 */
@Slf4j
public class QuerySizeLimiter implements QueryMiddleware {
  static final int MAX_CONCURRENT_STATS_REQUESTS = 10;

  private final Granularity granularity;
  private final LimitsSource limitsSource;
  private final SchemaTimeline schemaTimeline;
  private final IndexStatsHandler statsHandler;
  private final MatcherGroupExtractor matcherGroupExtractor;
  private final Duration maxLookBackPeriod;
  private final Clock clock;
  private final Counter rejectionCounter;

  public QuerySizeLimiter(
      Granularity granularity,
      LimitsSource limitsSource,
      SchemaTimeline schemaTimeline,
      IndexStatsHandler statsHandler,
      MatcherGroupExtractor matcherGroupExtractor,
      Duration maxLookBackPeriod,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.granularity = granularity;
    this.limitsSource = limitsSource;
    this.schemaTimeline = schemaTimeline;
    this.statsHandler = statsHandler;
    this.matcherGroupExtractor = matcherGroupExtractor;
    this.maxLookBackPeriod = maxLookBackPeriod;
    this.clock = clock;
    this.rejectionCounter =
        AdmissionMetrics.rejectionCounter(meterRegistry, granularity.getMiddlewareName());
  }

  @Override
  public String getName() {
    return this.granularity.getMiddlewareName();
  }

  @Override
  public QueryHandler wrap(QueryHandler next) {
    return (context, request) -> {
      TenantLimits limits = this.limitsSource.forRequest(context);
      long maxBytes = this.granularity.maxBytes(limits);
      if (maxBytes <= 0
          || !this.schemaTimeline.touches(IndexType.TSDB, request.getStart(), request.getEnd())) {
        return next.handle(context, request);
      }
      return this.checkBytesRead(context, request, limits, maxBytes)
          .andThen(Single.defer(() -> next.handle(context, request)));
    };
  }

  private Completable checkBytesRead(
      QueryContext context, QueryRequest request, TenantLimits limits, long maxBytes) {
    return Completable.defer(
        () -> {
          Map<MatcherGroup, QueryRequest> statsRequests = new LinkedHashMap<>();
          try {
            for (MatcherGroup group : this.matcherGroupExtractor.extract(request.getQuery())) {
              statsRequests.put(group, this.statsRequest(request, group, limits));
            }
          } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
            return Completable.error(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asException());
          }
          return Observable.fromIterable(statsRequests.entrySet())
              .flatMap(
                  entry ->
                      this.statsHandler
                          .stats(context, entry.getValue())
                          .flatMapCompletable(
                              stats ->
                                  this.verify(request, entry.getKey(), stats.getBytes(), maxBytes))
                          .toObservable(),
                  false,
                  MAX_CONCURRENT_STATS_REQUESTS)
              .ignoreElements();
        });
  }

  /**
   * The range a matcher group reads: its range interval and offset move the start back, and a
   * group without a range interval still looks back {@code maxLookBackPeriod} for its first
   * sample.
   */
  QueryRequest statsRequest(QueryRequest request, MatcherGroup group, TenantLimits limits) {
    Instant start = request.getStart().minus(group.getInterval()).minus(group.getOffset());
    if (!group.hasInterval()) {
      start = start.minus(this.maxLookBackPeriod);
    }
    Instant end = request.getEnd().minus(group.getOffset());
    if (!limits.getMaxQueryLookback().isZero()) {
      start = latest(start, this.clock.instant().minus(limits.getMaxQueryLookback()));
    }
    return request.toBuilder().query(group.getSelector()).start(start).end(end).build();
  }

  private Completable verify(
      QueryRequest request, MatcherGroup group, long bytes, long maxBytes) {
    if (bytes <= maxBytes) {
      log.debug(
          "Matcher group {} of {} reads {} bytes, within the {} bytes {} limit",
          group.getSelector(),
          request.getQuery(),
          bytes,
          maxBytes,
          this.granularity.getMiddlewareName());
      return Completable.complete();
    }
    this.rejectionCounter.increment();
    String message = this.granularity.rejectionMessage(bytes, maxBytes);
    log.warn("Rejecting query {}: {}", request.getQuery(), message);
    return Completable.error(Status.INVALID_ARGUMENT.withDescription(message).asException());
  }

  public enum Granularity {
    QUERY("query-size"),
    QUERIER("querier-size");

    private final String middlewareName;

    Granularity(String middlewareName) {
      this.middlewareName = middlewareName;
    }

    public String getMiddlewareName() {
      return middlewareName;
    }

    long maxBytes(TenantLimits limits) {
      return this == QUERY ? limits.getMaxQueryBytesRead() : limits.getMaxQuerierBytesRead();
    }

    String rejectionMessage(long bytes, long maxBytes) {
      if (this == QUERY) {
        return String.format(
            "the query would read too many bytes (query: %d bytes, limit: %d bytes); consider"
                + " adding more specific stream selectors or reduce the time range of the query",
            bytes, maxBytes);
      }
      return String.format(
          "query too large to execute on a single querier (query: %d bytes, limit: %d bytes);"
              + " consider adding more specific stream selectors, reduce the time range of the"
              + " query, or increase the querier's max bytes read limit",
          bytes, maxBytes);
    }
  }
}
