package org.hypertrace.core.query.frontend.util;

import java.time.Duration;
import java.time.Instant;
import org.hypertrace.core.query.frontend.api.Direction;
import org.hypertrace.core.query.frontend.api.QueryRequest;

/** Utility methods to easily create {@link QueryRequest}s and reason about their time range. */
public class QueryRequestUtil {
  public static final String QUERY_RANGE_PATH = "/loki/api/v1/query_range";
  public static final String INSTANT_QUERY_PATH = "/loki/api/v1/query";

  public static QueryRequest createRangeRequest(
      String query, Instant start, Instant end, Duration step) {
    return QueryRequest.builder()
        .query(query)
        .start(start)
        .end(end)
        .step(step)
        .direction(Direction.FORWARD)
        .path(QUERY_RANGE_PATH)
        .build();
  }

  public static QueryRequest createInstantRequest(String query, Instant time) {
    return QueryRequest.builder()
        .query(query)
        .start(time)
        .end(time)
        .direction(Direction.FORWARD)
        .path(INSTANT_QUERY_PATH)
        .build();
  }

  /** Length of the request's time range; zero when end is not after start. */
  public static Duration getTimeRangeDuration(QueryRequest request) {
    Duration duration = Duration.between(request.getStart(), request.getEnd());
    return duration.isNegative() ? Duration.ZERO : duration;
  }

  public static Instant latest(Instant first, Instant second) {
    return first.isAfter(second) ? first : second;
  }

  public static Instant earliest(Instant first, Instant second) {
    return first.isBefore(second) ? first : second;
  }
}
