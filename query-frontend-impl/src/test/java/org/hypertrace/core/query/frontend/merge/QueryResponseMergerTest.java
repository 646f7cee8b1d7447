package org.hypertrace.core.query.frontend.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.core.query.frontend.api.Direction;
import org.hypertrace.core.query.frontend.api.LogEntry;
import org.hypertrace.core.query.frontend.api.LogStream;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.api.QueryResponse.ResultType;
import org.hypertrace.core.query.frontend.api.Sample;
import org.hypertrace.core.query.frontend.api.Series;
import org.junit.jupiter.api.Test;

class QueryResponseMergerTest {
  private static final Map<String, String> APP_FOO = Map.of("app", "foo");
  private static final Map<String, String> APP_BAR = Map.of("app", "bar");

  private final QueryResponseMerger merger = new QueryResponseMerger();

  @Test
  void mergesMatrixSeriesByLabels() {
    QueryResponse first =
        QueryResponse.builder()
            .resultType(ResultType.MATRIX)
            .addSeries(series(APP_FOO, sample(0, 1), sample(60, 2)))
            .build();
    QueryResponse second =
        QueryResponse.builder()
            .resultType(ResultType.MATRIX)
            .addSeries(series(APP_BAR, sample(120, 5)))
            .addSeries(series(APP_FOO, sample(60, 99), sample(120, 3)))
            .build();

    QueryResponse merged =
        merger.merge(request("sum(rate({app=~\".+\"}[1m]))"), List.of(first, second));

    assertEquals(ResultType.MATRIX, merged.getResultType());
    assertEquals(2, merged.getSeries().size());
    Series foo = merged.getSeries().get(0);
    assertEquals(APP_FOO, foo.getLabels());
    assertEquals(List.of(sample(0, 1), sample(60, 2), sample(120, 3)), foo.getSamples());
    assertEquals(APP_BAR, merged.getSeries().get(1).getLabels());
  }

  @Test
  void ordersAndLimitsStreamsForward() {
    QueryRequest request = request("{app=~\".+\"}").toBuilder().limit(3).build();
    QueryResponse merged = merger.merge(request, streamResponses());

    assertEquals(ResultType.STREAMS, merged.getResultType());
    // streams keep the order their first entry appears in
    assertEquals(List.of("foo-1", "foo-3", "bar-2"), lines(merged));
    assertEquals(APP_FOO, merged.getStreams().get(0).getLabels());
  }

  @Test
  void ordersStreamsBackward() {
    QueryRequest request =
        request("{app=~\".+\"}").toBuilder().direction(Direction.BACKWARD).limit(2).build();
    QueryResponse merged = merger.merge(request, streamResponses());

    assertEquals(List.of("bar-4", "foo-3"), lines(merged));
    assertEquals(APP_BAR, merged.getStreams().get(0).getLabels());
  }

  @Test
  void zeroLimitKeepsAllEntries() {
    assertEquals(4, lines(merger.merge(request("{app=~\".+\"}"), streamResponses())).size());
  }

  @Test
  void handlesTrivialInputs() {
    QueryResponse only = QueryResponse.empty(ResultType.MATRIX);
    assertSame(only, merger.merge(request("rate({a=\"b\"}[1m])"), List.of(only)));
    assertEquals(
        ResultType.STREAMS, merger.merge(request(" {a=\"b\"}"), List.of()).getResultType());
    assertEquals(ResultType.MATRIX, merger.merge(request("vector(1)"), List.of()).getResultType());
  }

  private static List<QueryResponse> streamResponses() {
    QueryResponse first =
        QueryResponse.builder()
            .stream(stream(APP_FOO, entry(1, "foo-1")))
            .stream(stream(APP_BAR, entry(2, "bar-2")))
            .build();
    QueryResponse second =
        QueryResponse.builder()
            .stream(stream(APP_FOO, entry(3, "foo-3")))
            .stream(stream(APP_BAR, entry(4, "bar-4")))
            .build();
    return List.of(first, second);
  }

  private static List<String> lines(QueryResponse response) {
    return response.getStreams().stream()
        .flatMap(stream -> stream.getEntries().stream())
        .map(LogEntry::getLine)
        .collect(Collectors.toList());
  }

  private static QueryRequest request(String query) {
    return QueryRequest.builder()
        .query(query)
        .start(Instant.EPOCH)
        .end(Instant.EPOCH.plusSeconds(300))
        .build();
  }

  private static Series series(Map<String, String> labels, Sample... samples) {
    return Series.builder().labels(labels).samples(List.of(samples)).build();
  }

  private static Sample sample(long seconds, double value) {
    return new Sample(Instant.ofEpochSecond(seconds), value);
  }

  private static LogStream stream(Map<String, String> labels, LogEntry... entries) {
    return LogStream.builder().labels(labels).entries(List.of(entries)).build();
  }

  private static LogEntry entry(long seconds, String line) {
    return new LogEntry(Instant.ofEpochSecond(seconds), line);
  }
}
