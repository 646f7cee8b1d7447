package org.hypertrace.core.query.frontend.api;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A single range (or instant, when {@code start == end}) query as received by the frontend. The
 * same type describes every sub-request produced by splitting, and the statistics lookups issued
 * by the size limiters.
 *
 * <p>{@code start <= end} is expected but not enforced; components handle {@code start == end}
 * and {@code start > end} explicitly.
 */
@Value
@Builder(toBuilder = true)
public class QueryRequest {

  @NonNull String query;

  @NonNull Instant start;

  @NonNull Instant end;

  @NonNull @Builder.Default Duration step = Duration.ZERO;

  @NonNull @Builder.Default Direction direction = Direction.FORWARD;

  int limit;

  @NonNull @Builder.Default String path = "";

  public boolean isInstant() {
    return this.start.equals(this.end);
  }

  public QueryRequest withTimeRange(Instant start, Instant end) {
    return this.toBuilder().start(start).end(end).build();
  }
}
