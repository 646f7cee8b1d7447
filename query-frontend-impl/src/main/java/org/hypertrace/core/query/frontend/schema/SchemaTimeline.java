package org.hypertrace.core.query.frontend.schema;

import static org.hypertrace.core.query.frontend.util.QueryRequestUtil.earliest;
import static org.hypertrace.core.query.frontend.util.QueryRequestUtil.latest;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered schema periods. A period is effective from its own start until the start of the next
 * one; the last period never ends. Instances are immutable and safe to share between requests.
 */
public class SchemaTimeline {
  private final List<PeriodConfig> periods;

  public SchemaTimeline(List<PeriodConfig> periods) {
    for (int i = 1; i < periods.size(); i++) {
      Preconditions.checkArgument(
          periods.get(i - 1).getFrom().isBefore(periods.get(i).getFrom()),
          "Schema periods must be sorted by start and must not overlap: %s starts no later than %s",
          periods.get(i),
          periods.get(i - 1));
    }
    this.periods = List.copyOf(periods);
  }

  /**
   * Returns every period intersecting {@code [start, end)} with the clipped overlap, in timeline
   * order. Parts of the range before the first period are not covered by any entry. When {@code
   * start >= end} a single zero width entry is returned for the period active at {@code start}, or
   * for the first period when {@code start} precedes the timeline.
   */
  public List<PeriodOverlap> applicablePeriods(Instant start, Instant end) {
    if (this.periods.isEmpty()) {
      return List.of();
    }
    if (!start.isBefore(end)) {
      PeriodConfig period = this.periodAt(start).orElse(this.periods.get(0));
      return List.of(new PeriodOverlap(period, start, start));
    }

    List<PeriodOverlap> overlaps = new ArrayList<>();
    for (int i = 0; i < this.periods.size(); i++) {
      PeriodConfig period = this.periods.get(i);
      if (!period.getFrom().isBefore(end)) {
        break;
      }
      Optional<Instant> periodEnd = this.effectiveEnd(i);
      if (periodEnd.isPresent() && !periodEnd.get().isAfter(start)) {
        continue;
      }
      Instant overlapStart = latest(start, period.getFrom());
      Instant overlapEnd = periodEnd.map(boundary -> earliest(boundary, end)).orElse(end);
      overlaps.add(new PeriodOverlap(period, overlapStart, overlapEnd));
    }
    return overlaps;
  }

  /** The period in effect at {@code instant}, empty if it precedes the first period. */
  public Optional<PeriodConfig> periodAt(Instant instant) {
    PeriodConfig active = null;
    for (PeriodConfig period : this.periods) {
      if (period.getFrom().isAfter(instant)) {
        break;
      }
      active = period;
    }
    return Optional.ofNullable(active);
  }

  /** Whether any part of {@code [start, end]} is served by a period of the given index type. */
  public boolean touches(IndexType indexType, Instant start, Instant end) {
    return this.applicablePeriods(start, end).stream()
        .anyMatch(overlap -> overlap.getPeriod().getIndexType() == indexType);
  }

  private Optional<Instant> effectiveEnd(int index) {
    return index + 1 < this.periods.size()
        ? Optional.of(this.periods.get(index + 1).getFrom())
        : Optional.empty();
  }
}
