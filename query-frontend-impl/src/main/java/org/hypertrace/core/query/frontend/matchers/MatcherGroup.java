package org.hypertrace.core.query.frontend.matchers;

import java.time.Duration;
import lombok.NonNull;
import lombok.Value;

/**
 * A stream selector of a query together with the range interval and offset applied to it. Log
 * selectors and instant vector selectors have a zero interval.
 */
@Value
public class MatcherGroup {
  @NonNull String selector;
  @NonNull Duration interval;
  @NonNull Duration offset;

  public boolean hasInterval() {
    return !this.interval.isZero();
  }
}
