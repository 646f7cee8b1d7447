package org.hypertrace.core.query.frontend.api;

import lombok.Builder;
import lombok.Value;

/** Index statistics for a stream selector over a time range, as answered by the indexed store. */
@Value
@Builder
public class IndexStats {
  long streams;
  long chunks;
  long bytes;
  long entries;
}
