package org.hypertrace.core.query.frontend.api;

import java.time.Instant;
import lombok.Value;

@Value
public class LogEntry {
  Instant timestamp;
  String line;
}
