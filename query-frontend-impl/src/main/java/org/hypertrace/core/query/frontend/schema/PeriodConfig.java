package org.hypertrace.core.query.frontend.schema;

import com.typesafe.config.Config;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import lombok.NonNull;
import lombok.Value;

/** A schema period: from its start day on, the given index type serves the data. */
@Value
public class PeriodConfig {
  private static final String CONFIG_PATH_FROM = "from";
  private static final String CONFIG_PATH_INDEX_TYPE = "indexType";

  @NonNull Instant from;
  @NonNull IndexType indexType;

  /** Parses a period whose {@code from} is a {@code yyyy-MM-dd} day, starting at UTC midnight. */
  public static PeriodConfig fromConfig(Config config) {
    return new PeriodConfig(
        LocalDate.parse(config.getString(CONFIG_PATH_FROM))
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant(),
        IndexType.fromConfigName(config.getString(CONFIG_PATH_INDEX_TYPE)));
  }
}
