package org.hypertrace.core.query.frontend;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.hypertrace.core.query.frontend.schema.PeriodConfig;

@Value
@NonFinal
public class QueryFrontendConfig {

  private static final String CONFIG_PATH_DEFAULT_SPLIT_INTERVAL = "split.defaultInterval";
  private static final String CONFIG_PATH_MAX_LOOK_BACK_PERIOD = "engine.maxLookBackPeriod";
  private static final String CONFIG_PATH_MIDDLEWARES = "middlewares";
  private static final String CONFIG_PATH_SCHEMA_PERIODS = "schema.periods";
  private static final String CONFIG_PATH_LIMITS = "limits";
  private static final String CONFIG_PATH_LIMIT_VALIDATION = "validation.limit";
  private static final String CONFIG_PATH_DOWNSTREAM = "downstream";

  Duration defaultSplitInterval;
  Duration maxLookBackPeriod;
  List<String> middlewareNames;
  List<PeriodConfig> schemaPeriods;
  Config limitsConfig;
  LimitValidationConfig limitValidationConfig;
  Config downstreamConfig;

  QueryFrontendConfig(Config config) {
    Config resolved = config.resolve();
    this.defaultSplitInterval = resolved.getDuration(CONFIG_PATH_DEFAULT_SPLIT_INTERVAL);
    this.maxLookBackPeriod = resolved.getDuration(CONFIG_PATH_MAX_LOOK_BACK_PERIOD);
    this.middlewareNames = List.copyOf(resolved.getStringList(CONFIG_PATH_MIDDLEWARES));
    this.schemaPeriods =
        resolved.getConfigList(CONFIG_PATH_SCHEMA_PERIODS).stream()
            .map(PeriodConfig::fromConfig)
            .collect(Collectors.toUnmodifiableList());
    this.limitsConfig = resolved.getConfig(CONFIG_PATH_LIMITS);
    this.limitValidationConfig =
        new LimitValidationConfig(resolved.getConfig(CONFIG_PATH_LIMIT_VALIDATION));
    this.downstreamConfig = resolved.getConfig(CONFIG_PATH_DOWNSTREAM);
  }

  @Value
  @NonFinal
  public static class LimitValidationConfig {
    private static final String CONFIG_PATH_MIN = "min";
    private static final String CONFIG_PATH_MAX = "max";
    private static final String CONFIG_PATH_MODE = "mode";
    int min;
    int max;
    LimitValidationMode mode;

    private LimitValidationConfig(Config config) {
      this.min = config.getInt(CONFIG_PATH_MIN);
      this.max = config.getInt(CONFIG_PATH_MAX);
      this.mode = config.getEnum(LimitValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum LimitValidationMode {
      DISABLED,
      WARN,
      ERROR
    }
  }
}
