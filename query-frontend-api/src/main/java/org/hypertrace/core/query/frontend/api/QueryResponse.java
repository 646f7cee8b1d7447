package org.hypertrace.core.query.frontend.api;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Result of a query or sub-query. A metric query answers with {@link ResultType#MATRIX} series, a
 * log query with {@link ResultType#STREAMS}. The frontend only looks inside a response to merge
 * partial results and to count distinct series.
 */
@Value
@Builder(toBuilder = true)
public class QueryResponse {
  public static final String STATUS_SUCCESS = "success";

  @NonNull @Builder.Default String status = STATUS_SUCCESS;

  @NonNull @Builder.Default ResultType resultType = ResultType.STREAMS;

  @Singular("addSeries") List<Series> series;

  @Singular List<LogStream> streams;

  public static QueryResponse empty(ResultType resultType) {
    return QueryResponse.builder().resultType(resultType).build();
  }

  /** Distinct label sets of every series and stream in this response. */
  public Set<Map<String, String>> labelSets() {
    return Stream.concat(
            this.series.stream().map(Series::getLabels),
            this.streams.stream().map(LogStream::getLabels))
        .collect(Collectors.toUnmodifiableSet());
  }

  public enum ResultType {
    MATRIX,
    STREAMS
  }
}
