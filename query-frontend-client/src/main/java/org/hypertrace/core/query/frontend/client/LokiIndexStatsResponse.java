package org.hypertrace.core.query.frontend.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.core.query.frontend.api.IndexStats;

@Value
@Jacksonized
@Builder
class LokiIndexStatsResponse {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @JsonProperty("streams")
  long streams;

  @JsonProperty("chunks")
  long chunks;

  @JsonProperty("bytes")
  long bytes;

  @JsonProperty("entries")
  long entries;

  static LokiIndexStatsResponse fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, LokiIndexStatsResponse.class);
  }

  IndexStats toIndexStats() {
    return IndexStats.builder()
        .streams(this.streams)
        .chunks(this.chunks)
        .bytes(this.bytes)
        .entries(this.entries)
        .build();
  }
}
