package org.hypertrace.core.query.frontend.schema;

import java.time.Duration;
import java.time.Instant;
import lombok.Value;

/** The part of a query range that falls into one schema period. */
@Value
public class PeriodOverlap {
  PeriodConfig period;
  Instant overlapStart;
  Instant overlapEnd;

  public Duration getDuration() {
    return Duration.between(overlapStart, overlapEnd);
  }

  public boolean isDegenerate() {
    return !overlapStart.isBefore(overlapEnd);
  }
}
