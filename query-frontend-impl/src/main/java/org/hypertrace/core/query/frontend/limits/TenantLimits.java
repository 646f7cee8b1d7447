package org.hypertrace.core.query.frontend.limits;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Per tenant query limits. A zero size, series, lookback or length limit means unlimited; a zero
 * split duration means the configured default split interval applies.
 */
@Value
@Builder(toBuilder = true)
public class TenantLimits {
  private static final String CONFIG_PATH_SPLIT_QUERIES_BY_INTERVAL = "splitQueriesByInterval";
  private static final String CONFIG_PATH_MAX_QUERY_PARALLELISM = "maxQueryParallelism";
  private static final String CONFIG_PATH_TSDB_MAX_QUERY_PARALLELISM = "tsdbMaxQueryParallelism";
  private static final String CONFIG_PATH_MAX_QUERY_LOOKBACK = "maxQueryLookback";
  private static final String CONFIG_PATH_MAX_QUERY_LENGTH = "maxQueryLength";
  private static final String CONFIG_PATH_MAX_QUERY_BYTES_READ = "maxQueryBytesRead";
  private static final String CONFIG_PATH_MAX_QUERIER_BYTES_READ = "maxQuerierBytesRead";
  private static final String CONFIG_PATH_MAX_QUERY_SERIES = "maxQuerySeries";

  @NonNull @Builder.Default Duration splitQueriesByInterval = Duration.ZERO;
  int maxQueryParallelism;
  int tsdbMaxQueryParallelism;
  @NonNull @Builder.Default Duration maxQueryLookback = Duration.ZERO;
  @NonNull @Builder.Default Duration maxQueryLength = Duration.ZERO;
  long maxQueryBytesRead;
  long maxQuerierBytesRead;
  int maxQuerySeries;

  /** Reads a fully specified limits block, as found under {@code limits.defaults}. */
  public static TenantLimits fromConfig(Config config) {
    return TenantLimits.builder()
        .splitQueriesByInterval(config.getDuration(CONFIG_PATH_SPLIT_QUERIES_BY_INTERVAL))
        .maxQueryParallelism(config.getInt(CONFIG_PATH_MAX_QUERY_PARALLELISM))
        .tsdbMaxQueryParallelism(config.getInt(CONFIG_PATH_TSDB_MAX_QUERY_PARALLELISM))
        .maxQueryLookback(config.getDuration(CONFIG_PATH_MAX_QUERY_LOOKBACK))
        .maxQueryLength(config.getDuration(CONFIG_PATH_MAX_QUERY_LENGTH))
        .maxQueryBytesRead(config.getBytes(CONFIG_PATH_MAX_QUERY_BYTES_READ))
        .maxQuerierBytesRead(config.getBytes(CONFIG_PATH_MAX_QUERIER_BYTES_READ))
        .maxQuerySeries(config.getInt(CONFIG_PATH_MAX_QUERY_SERIES))
        .build();
  }
}
