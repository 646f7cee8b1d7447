package org.hypertrace.core.query.frontend.merge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.inject.Singleton;
import org.hypertrace.core.query.frontend.api.Direction;
import org.hypertrace.core.query.frontend.api.LogEntry;
import org.hypertrace.core.query.frontend.api.LogStream;
import org.hypertrace.core.query.frontend.api.QueryRequest;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.api.QueryResponse.ResultType;
import org.hypertrace.core.query.frontend.api.Sample;
import org.hypertrace.core.query.frontend.api.Series;

/**
 * Combines the responses of split sub-queries, given in request order, into the response of the
 * original request.
 */
@Singleton
public class QueryResponseMerger {

  public QueryResponse merge(QueryRequest request, List<QueryResponse> responses) {
    if (responses.isEmpty()) {
      return QueryResponse.empty(resultTypeOf(request));
    }
    if (responses.size() == 1) {
      return responses.get(0);
    }
    return responses.get(0).getResultType() == ResultType.MATRIX
        ? mergeMatrix(responses)
        : mergeStreams(request, responses);
  }

  /** Log queries start with a stream selector, anything else evaluates to samples. */
  public static ResultType resultTypeOf(QueryRequest request) {
    return request.getQuery().trim().startsWith("{") ? ResultType.STREAMS : ResultType.MATRIX;
  }

  private QueryResponse mergeMatrix(List<QueryResponse> responses) {
    Map<Map<String, String>, TreeMap<Instant, Sample>> samplesByLabels = new LinkedHashMap<>();
    for (QueryResponse response : responses) {
      for (Series series : response.getSeries()) {
        TreeMap<Instant, Sample> samples =
            samplesByLabels.computeIfAbsent(series.getLabels(), unused -> new TreeMap<>());
        // a sample on a split boundary can come back twice
        series.getSamples().forEach(sample -> samples.putIfAbsent(sample.getTimestamp(), sample));
      }
    }

    QueryResponse.QueryResponseBuilder merged =
        QueryResponse.builder().resultType(ResultType.MATRIX);
    samplesByLabels.forEach(
        (labels, samples) ->
            merged.addSeries(
                Series.builder().labels(labels).samples(samples.values()).build()));
    return merged.build();
  }

  private QueryResponse mergeStreams(QueryRequest request, List<QueryResponse> responses) {
    List<LabeledEntry> entries = new ArrayList<>();
    for (QueryResponse response : responses) {
      for (LogStream stream : response.getStreams()) {
        for (LogEntry entry : stream.getEntries()) {
          entries.add(new LabeledEntry(stream.getLabels(), entry));
        }
      }
    }

    Comparator<LabeledEntry> byTimestamp = Comparator.comparing(e -> e.entry.getTimestamp());
    entries.sort(
        request.getDirection() == Direction.BACKWARD ? byTimestamp.reversed() : byTimestamp);
    List<LabeledEntry> kept =
        request.getLimit() > 0 && entries.size() > request.getLimit()
            ? entries.subList(0, request.getLimit())
            : entries;

    Map<Map<String, String>, List<LogEntry>> entriesByLabels =
        kept.stream()
            .collect(
                Collectors.groupingBy(
                    labeled -> labeled.labels,
                    LinkedHashMap::new,
                    Collectors.mapping(labeled -> labeled.entry, Collectors.toList())));

    QueryResponse.QueryResponseBuilder merged =
        QueryResponse.builder().resultType(ResultType.STREAMS);
    entriesByLabels.forEach(
        (labels, streamEntries) ->
            merged.stream(LogStream.builder().labels(labels).entries(streamEntries).build()));
    return merged.build();
  }

  private static final class LabeledEntry {
    private final Map<String, String> labels;
    private final LogEntry entry;

    private LabeledEntry(Map<String, String> labels, LogEntry entry) {
      this.labels = labels;
      this.entry = entry;
    }
  }
}
