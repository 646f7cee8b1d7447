package org.hypertrace.core.query.frontend.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
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
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.api.QueryResponse.ResultType;
import org.hypertrace.core.query.frontend.limits.TenantLimits;
import org.hypertrace.core.query.frontend.util.QueryRequestUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QueryTimeRangeLimiterTest {
  private static final Instant NOW = Instant.parse("2023-06-15T12:00:00Z");
  private static final String LOG_QUERY = "{app=\"foo\"} |= \"foo\"";

  private final QueryContext context = QueryContext.forTenant("1");
  private QueryHandler downstream;

  @BeforeEach
  void setup() {
    downstream = mock(QueryHandler.class);
    when(downstream.handle(any(), any()))
        .thenReturn(Single.just(QueryResponse.empty(ResultType.STREAMS)));
  }

  @Test
  void answersEmptyWhenRangeIsPastLookback() {
    QueryHandler handler =
        limiter(TenantLimits.builder().maxQueryLookback(Duration.ofHours(1)).build());

    QueryResponse response =
        handler
            .handle(
                context, request(NOW.minus(Duration.ofHours(6)), NOW.minus(Duration.ofHours(2))))
            .blockingGet();

    assertEquals(QueryResponse.STATUS_SUCCESS, response.getStatus());
    assertEquals(ResultType.STREAMS, response.getResultType());
    assertTrue(response.getStreams().isEmpty());
    verify(downstream, never()).handle(any(), any());
  }

  @Test
  void clampsStartToLookback() {
    QueryHandler handler =
        limiter(TenantLimits.builder().maxQueryLookback(Duration.ofHours(1)).build());

    handler.handle(context, request(NOW.minus(Duration.ofHours(6)), NOW)).blockingGet();

    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(downstream).handle(any(), captor.capture());
    assertEquals(NOW.minus(Duration.ofHours(1)), captor.getValue().getStart());
    assertEquals(NOW, captor.getValue().getEnd());
  }

  @Test
  void leavesRequestUntouchedWithoutLimits() {
    QueryRequest request = request(NOW.minus(Duration.ofDays(60)), NOW);

    limiter(TenantLimits.builder().build()).handle(context, request).blockingGet();

    verify(downstream).handle(context, request);
  }

  @Test
  void rejectsRangeLongerThanMaxLength() {
    QueryHandler handler =
        limiter(TenantLimits.builder().maxQueryLength(Duration.ofHours(1)).build());

    handler
        .handle(context, request(NOW.minus(Duration.ofHours(2)), NOW))
        .test()
        .assertError(
            error -> {
              Status status = Status.fromThrowable(error);
              return status.getCode() == Code.INVALID_ARGUMENT
                  && status.getDescription().startsWith("the query time range exceeds the limit");
            });
    verify(downstream, never()).handle(any(), any());
  }

  @Test
  void measuresLengthAfterLookbackClamp() {
    TenantLimits limits =
        TenantLimits.builder()
            .maxQueryLookback(Duration.ofHours(1))
            .maxQueryLength(Duration.ofHours(1))
            .build();

    limiter(limits).handle(context, request(NOW.minus(Duration.ofHours(6)), NOW)).blockingGet();

    verify(downstream).handle(any(), any());
  }

  private QueryHandler limiter(TenantLimits limits) {
    return new QueryTimeRangeLimiter(
            tenantId -> limits, Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry())
        .wrap(downstream);
  }

  private static QueryRequest request(Instant start, Instant end) {
    return QueryRequestUtil.createRangeRequest(LOG_QUERY, start, end, Duration.ZERO);
  }
}
