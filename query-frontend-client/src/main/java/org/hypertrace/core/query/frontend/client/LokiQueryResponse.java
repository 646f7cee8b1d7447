package org.hypertrace.core.query.frontend.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.core.query.frontend.api.LogEntry;
import org.hypertrace.core.query.frontend.api.LogStream;
import org.hypertrace.core.query.frontend.api.QueryResponse;
import org.hypertrace.core.query.frontend.api.QueryResponse.ResultType;
import org.hypertrace.core.query.frontend.api.Sample;
import org.hypertrace.core.query.frontend.api.Series;

@Value
@Jacksonized
@Builder
class LokiQueryResponse {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

  private static final String RESULT_TYPE_STREAMS = "streams";

  @JsonProperty("status")
  String status;

  @JsonProperty("data")
  LokiData data;

  @Value
  @Jacksonized
  @Builder
  static class LokiData {
    @JsonProperty("resultType")
    String resultType;

    @JsonProperty("result")
    List<LokiResult> result;
  }

  @Value
  @Builder
  @NoArgsConstructor(force = true)
  @AllArgsConstructor
  static class LokiResult {
    @JsonAlias({"metric", "stream"})
    @Singular
    Map<String, String> labels;

    @JsonAlias({"value", "values"})
    @JsonDeserialize(using = LokiResultValuesDeserializer.class)
    @Singular
    List<LokiResultValue> values;
  }

  /** Raw pair of a result: the timestamp is seconds for metric results, nanoseconds for logs. */
  @Value
  static class LokiResultValue {
    BigDecimal timestamp;
    String value;
  }

  static class LokiResultValuesDeserializer extends JsonDeserializer<List<LokiResultValue>> {

    @Override
    public List<LokiResultValue> deserialize(JsonParser parser, DeserializationContext context)
        throws IOException {
      List<LokiResultValue> resultValues = new ArrayList<>();
      JsonNode node = parser.getCodec().readTree(parser);
      if (node.isArray() && node.size() > 0 && node.get(0).isArray()) {
        node.elements().forEachRemaining(element -> resultValues.add(parseValue(element)));
      } else if (node.isArray() && node.size() > 0) {
        resultValues.add(parseValue(node));
      }
      return resultValues;
    }

    private LokiResultValue parseValue(JsonNode pair) {
      JsonNode timestamp = pair.get(0);
      BigDecimal parsedTimestamp =
          timestamp.isNumber() ? timestamp.decimalValue() : new BigDecimal(timestamp.asText());
      return new LokiResultValue(parsedTimestamp, pair.get(1).asText());
    }
  }

  static LokiQueryResponse fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, LokiQueryResponse.class);
  }

  QueryResponse toQueryResponse() {
    List<LokiResult> results =
        this.data == null || this.data.getResult() == null ? List.of() : this.data.getResult();
    boolean isStreams = this.data != null && RESULT_TYPE_STREAMS.equals(this.data.getResultType());

    QueryResponse.QueryResponseBuilder builder =
        QueryResponse.builder()
            .status(this.status == null ? QueryResponse.STATUS_SUCCESS : this.status)
            .resultType(isStreams ? ResultType.STREAMS : ResultType.MATRIX);
    for (LokiResult result : results) {
      if (isStreams) {
        LogStream.LogStreamBuilder stream = LogStream.builder().labels(result.getLabels());
        result
            .getValues()
            .forEach(
                value ->
                    stream.entry(
                        new LogEntry(fromEpochNanos(value.getTimestamp()), value.getValue())));
        builder.stream(stream.build());
      } else {
        Series.SeriesBuilder series = Series.builder().labels(result.getLabels());
        result
            .getValues()
            .forEach(
                value ->
                    series.sample(
                        new Sample(
                            fromEpochSeconds(value.getTimestamp()),
                            Double.parseDouble(value.getValue()))));
        builder.addSeries(series.build());
      }
    }
    return builder.build();
  }

  private static Instant fromEpochNanos(BigDecimal nanos) {
    return Instant.ofEpochSecond(0, nanos.longValue());
  }

  private static Instant fromEpochSeconds(BigDecimal seconds) {
    return Instant.ofEpochMilli(seconds.movePointRight(3).longValue());
  }
}
