package org.hypertrace.core.query.frontend.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.grpc.Status;
import io.grpc.Status.Code;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.reactivex.rxjava3.core.Single;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.hypertrace.core.query.frontend.admission.QuerySizeLimiter.Granularity;
import org.hypertrace.core.query.frontend.api.IndexStats;
import org.hypertrace.core.query.frontend.api.IndexStatsHandler;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.limits.TenantLimits;
import org.hypertrace.core.query.frontend.matchers.MatcherGroupExtractor;
import org.hypertrace.core.query.frontend.schema.IndexType;
import org.hypertrace.core.query.frontend.schema.PeriodConfig;
import org.hypertrace.core.query.frontend.schema.SchemaTimeline;
import org.hypertrace.core.query.frontend.util.QueryRequestUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QuerySizeLimiterTest {
  private static final Instant TEST_TIME = Instant.parse("2023-06-15T12:00:00Z");
  private static final long STATS_BYTES = 1000;
  private static final SchemaTimeline SCHEMAS =
      new SchemaTimeline(
          List.of(
              new PeriodConfig(TEST_TIME.minus(Duration.ofHours(96)), IndexType.BOLTDB_SHIPPER),
              new PeriodConfig(TEST_TIME.minus(Duration.ofHours(48)), IndexType.TSDB)));

  private final QueryContext context = QueryContext.forTenant("fake");
  private final QueryResponse downstreamResponse =
      QueryResponse.empty(QueryResponse.ResultType.MATRIX);
  private IndexStatsHandler statsHandler;
  private QueryHandler downstream;

  @BeforeEach
  void setup() {
    statsHandler = mock(IndexStatsHandler.class);
    downstream = mock(QueryHandler.class);
    when(downstream.handle(any(), any())).thenReturn(Single.just(downstreamResponse));
    statsReturn(STATS_BYTES);
  }

  @Test
  void passesThroughWithoutBudget() {
    QueryHandler handler =
        limiter(Granularity.QUERY, TenantLimits.builder().build()).wrap(downstream);

    assertEquals(
        downstreamResponse,
        handler.handle(context, recentRangeRequest("{app=\"foo\"}")).blockingGet());
    verify(statsHandler, never()).stats(any(), any());
  }

  @Test
  void skipsStatsOutsideTsdbPeriods() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);
    QueryRequest boltdbOnly =
        QueryRequestUtil.createRangeRequest(
            "{app=\"foo\"}",
            TEST_TIME.minus(Duration.ofHours(96)),
            TEST_TIME.minus(Duration.ofHours(90)),
            Duration.ofMinutes(1));

    handler.handle(context, boltdbOnly).blockingGet();
    verify(statsHandler, never()).stats(any(), any());
    verify(downstream).handle(context, boltdbOnly);
  }

  @Test
  void allowsQueryReadingExactlyTheBudget() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);

    assertEquals(
        downstreamResponse,
        handler.handle(context, recentRangeRequest("{app=\"foo\"}")).blockingGet());
    verify(statsHandler, times(1)).stats(any(), any());
  }

  @Test
  void rejectsQueryOverBudgetBeforeDownstream() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES - 1)).wrap(downstream);

    handler
        .handle(context, recentRangeRequest("{app=\"foo\"}"))
        .test()
        .assertError(
            error -> {
              Status status = Status.fromThrowable(error);
              return status.getCode() == Code.INVALID_ARGUMENT
                  && status.getDescription().startsWith("the query would read too many bytes");
            });
    verify(downstream, never()).handle(any(), any());
  }

  @Test
  void querierGranularityUsesQuerierBudget() {
    TenantLimits limits =
        TenantLimits.builder().maxQueryBytesRead(STATS_BYTES).maxQuerierBytesRead(10).build();
    QueryHandler handler = limiter(Granularity.QUERIER, limits).wrap(downstream);

    handler
        .handle(context, recentRangeRequest("{app=\"foo\"}"))
        .test()
        .assertError(
            error ->
                Status.fromThrowable(error)
                    .getDescription()
                    .startsWith("query too large to execute on a single querier"));
  }

  @Test
  void queryLimiterFailsBeforeQuerierLimiterRuns() {
    IndexStatsHandler querierStats = mock(IndexStatsHandler.class);
    TenantLimits limits =
        TenantLimits.builder()
            .maxQueryBytesRead(STATS_BYTES - 1)
            .maxQuerierBytesRead(STATS_BYTES)
            .build();
    QuerySizeLimiter querierLimiter =
        new QuerySizeLimiter(
            Granularity.QUERIER,
            tenantId -> limits,
            SCHEMAS,
            querierStats,
            new MatcherGroupExtractor(),
            Duration.ofMinutes(5),
            Clock.fixed(TEST_TIME, ZoneOffset.UTC),
            new SimpleMeterRegistry());
    QueryHandler handler = limiter(Granularity.QUERY, limits).wrap(querierLimiter.wrap(downstream));

    handler
        .handle(context, recentRangeRequest("{app=\"foo\"}"))
        .test()
        .assertError(error -> Status.fromThrowable(error).getCode() == Code.INVALID_ARGUMENT);
    verify(querierStats, never()).stats(any(), any());
    verify(downstream, never()).handle(any(), any());
  }

  @Test
  void looksUpEveryMatcherGroup() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);

    handler
        .handle(
            context,
            recentRangeRequest(
                "sum_over_time({app=\"foo\"} | unwrap bytes [1h])"
                    + " / sum_over_time({app=\"bar\"} | unwrap bytes [1h])"))
        .blockingGet();
    verify(statsHandler, times(2)).stats(any(), any());
  }

  @Test
  void widensInstantSelectorByEngineLookback() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);

    handler
        .handle(context, QueryRequestUtil.createInstantRequest("{app=\"foo\"}", TEST_TIME))
        .blockingGet();

    QueryRequest statsRequest = capturedStatsRequest();
    assertEquals(TEST_TIME.minus(Duration.ofMinutes(5)), statsRequest.getStart());
    assertEquals(TEST_TIME, statsRequest.getEnd());
    assertEquals("{app=\"foo\"}", statsRequest.getQuery());
  }

  @Test
  void shiftsStatsRangeByIntervalAndOffset() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);

    handler
        .handle(context, recentRangeRequest("rate({app=\"foo\"}[10m] offset 1h)"))
        .blockingGet();

    QueryRequest statsRequest = capturedStatsRequest();
    assertEquals(
        TEST_TIME.minus(Duration.ofHours(2)).minus(Duration.ofMinutes(10)),
        statsRequest.getStart());
    assertEquals(TEST_TIME.minus(Duration.ofHours(1)), statsRequest.getEnd());
  }

  @Test
  void clampsStatsStartToTenantLookback() {
    TenantLimits limits =
        budget(STATS_BYTES).toBuilder().maxQueryLookback(Duration.ofMinutes(30)).build();
    QueryHandler handler = limiter(Granularity.QUERY, limits).wrap(downstream);

    handler.handle(context, recentRangeRequest("{app=\"foo\"}")).blockingGet();

    assertEquals(TEST_TIME.minus(Duration.ofMinutes(30)), capturedStatsRequest().getStart());
  }

  @Test
  void rejectsUnparseableQuery() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);

    handler
        .handle(context, recentRangeRequest("rate({app=\"foo\"}[5 minutes])"))
        .test()
        .assertError(error -> Status.fromThrowable(error).getCode() == Code.INVALID_ARGUMENT);
    verify(downstream, never()).handle(any(), any());
  }

  @Test
  void rejectsRangesBeyondRepresentableTime() {
    QueryHandler handler = limiter(Granularity.QUERY, budget(STATS_BYTES)).wrap(downstream);

    for (String range : List.of("99999999999999y", "2000000000y")) {
      handler
          .handle(context, recentRangeRequest("rate({app=\"foo\"}[" + range + "])"))
          .test()
          .assertError(error -> Status.fromThrowable(error).getCode() == Code.INVALID_ARGUMENT);
    }
    verify(statsHandler, never()).stats(any(), any());
    verify(downstream, never()).handle(any(), any());
  }

  private QuerySizeLimiter limiter(Granularity granularity, TenantLimits limits) {
    return new QuerySizeLimiter(
        granularity,
        tenantId -> limits,
        SCHEMAS,
        statsHandler,
        new MatcherGroupExtractor(),
        Duration.ofMinutes(5),
        Clock.fixed(TEST_TIME, ZoneOffset.UTC),
        new SimpleMeterRegistry());
  }

  private static TenantLimits budget(long maxBytes) {
    return TenantLimits.builder().maxQueryBytesRead(maxBytes).build();
  }

  private void statsReturn(long bytes) {
    when(statsHandler.stats(any(), any()))
        .thenReturn(
            Single.just(
                IndexStats.builder().streams(1).chunks(2).bytes(bytes).entries(10).build()));
  }

  private QueryRequest capturedStatsRequest() {
    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(statsHandler).stats(any(), captor.capture());
    return captor.getValue();
  }

  private static QueryRequest recentRangeRequest(String query) {
    return QueryRequestUtil.createRangeRequest(
        query, TEST_TIME.minus(Duration.ofHours(1)), TEST_TIME, Duration.ofMinutes(1));
  }
}
