package org.hypertrace.core.query.frontend.split;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Singleton;
import org.hypertrace.core.query.frontend.api.QueryRequest;

/**
 * Splits a request into sub-requests on interval boundaries aligned to the epoch, so the same
 * wall clock interval always lands in the same piece regardless of where the query starts.
 */
@Singleton
public class QuerySplitter {

  /**
   * Returns the pieces {@code [k*w, (k+1)*w)} clipped to {@code [start, end)} in chronological
   * order. A non positive width or an empty range returns the request itself as the only element.
   */
  public List<QueryRequest> split(QueryRequest request, Duration interval) {
    long width = interval.toMillis();
    if (width <= 0 || !request.getStart().isBefore(request.getEnd())) {
      return List.of(request);
    }

    long start = request.getStart().toEpochMilli();
    long end = request.getEnd().toEpochMilli();
    List<QueryRequest> splits = new ArrayList<>();
    for (long from = start; from < end; ) {
      long nextBoundary = Math.floorDiv(from, width) * width + width;
      long to = Math.min(nextBoundary, end);
      splits.add(request.withTimeRange(Instant.ofEpochMilli(from), Instant.ofEpochMilli(to)));
      from = to;
    }
    return splits;
  }
}
