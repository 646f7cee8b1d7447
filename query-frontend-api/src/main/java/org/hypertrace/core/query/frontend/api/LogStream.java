package org.hypertrace.core.query.frontend.api;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** One log stream of a streams result, identified by its label set. */
@Value
@Builder(toBuilder = true)
public class LogStream {
  @Singular Map<String, String> labels;
  @Singular List<LogEntry> entries;
}
