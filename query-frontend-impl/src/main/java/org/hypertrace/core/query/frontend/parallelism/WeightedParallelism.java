package org.hypertrace.core.query.frontend.parallelism;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.frontend.limits.TenantLimits;
import org.hypertrace.core.query.frontend.schema.IndexType;
import org.hypertrace.core.query.frontend.schema.PeriodConfig;
import org.hypertrace.core.query.frontend.schema.PeriodOverlap;
import org.hypertrace.core.query.frontend.schema.SchemaTimeline;

/**
 * Derives the max parallelism of a query from the schema periods it spans. TSDB periods use the
 * tenant's TSDB parallelism, every other index type the regular one; a range crossing a period
 * boundary gets the duration weighted sum of both.
 */
@Singleton
public class WeightedParallelism {
  private final SchemaTimeline schemaTimeline;

  @Inject
  public WeightedParallelism(SchemaTimeline schemaTimeline) {
    this.schemaTimeline = schemaTimeline;
  }

  /**
   * Returns the parallelism for {@code [start, end]}. Zero means parallelism is disabled for the
   * tenant and the query must be rejected; any other degenerate input yields at least one.
   */
  public int calculate(TenantLimits limits, Instant start, Instant end) {
    int tsdbLimit = limits.getTsdbMaxQueryParallelism();
    int regularLimit = limits.getMaxQueryParallelism();
    if (tsdbLimit + regularLimit == 0) {
      return 0;
    }
    if (end.isBefore(start)) {
      return 1;
    }

    List<PeriodOverlap> overlaps = this.schemaTimeline.applicablePeriods(start, end);
    if (start.equals(end)) {
      return overlaps.isEmpty() ? 1 : limitFor(overlaps.get(0).getPeriod(), limits);
    }

    long tsdbMillis = 0;
    long otherMillis = 0;
    for (PeriodOverlap overlap : overlaps) {
      if (overlap.getPeriod().getIndexType() == IndexType.TSDB) {
        tsdbMillis += overlap.getDuration().toMillis();
      } else {
        otherMillis += overlap.getDuration().toMillis();
      }
    }
    long totalMillis = tsdbMillis + otherMillis;
    if (totalMillis == 0) {
      return 1;
    }

    // each class is floored on its own: 75% of 10 and 25% of 100 gives 7 + 25
    long tsdbPart = share(tsdbMillis, tsdbLimit, totalMillis);
    long regularPart = share(otherMillis, regularLimit, totalMillis);
    long combined = tsdbPart + regularPart;
    if (combined > 0) {
      return (int) Math.min(combined, Integer.MAX_VALUE);
    }
    if ((tsdbLimit > 0 && tsdbMillis > 0) || (regularLimit > 0 && otherMillis > 0)) {
      return 1;
    }
    return 0;
  }

  /** {@code floor(millis * limit / totalMillis)} without overflowing on long ranges. */
  private static long share(long millis, int limit, long totalMillis) {
    return BigInteger.valueOf(millis)
        .multiply(BigInteger.valueOf(limit))
        .divide(BigInteger.valueOf(totalMillis))
        .longValueExact();
  }

  private static int limitFor(PeriodConfig period, TenantLimits limits) {
    return period.getIndexType() == IndexType.TSDB
        ? limits.getTsdbMaxQueryParallelism()
        : limits.getMaxQueryParallelism();
  }
}
