package org.hypertrace.core.query.frontend.limits;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import java.util.HashMap;
import java.util.Map;
import java.util.Map.Entry;
import lombok.extern.slf4j.Slf4j;

/**
 * Limits read from configuration: a {@code defaults} block and an optional {@code overrides}
 * object keyed by tenant id. Each override only needs the keys it changes, the rest fall back to
 * the defaults.
 */
@Slf4j
public class ConfigLimitsSource implements LimitsSource {
  private static final String CONFIG_PATH_DEFAULTS = "defaults";
  private static final String CONFIG_PATH_OVERRIDES = "overrides";

  private final TenantLimits defaults;
  private final Map<String, TenantLimits> overrides;

  public ConfigLimitsSource(Config config) {
    Config defaultsConfig = config.getConfig(CONFIG_PATH_DEFAULTS);
    this.defaults = TenantLimits.fromConfig(defaultsConfig);

    Map<String, TenantLimits> tenantOverrides = new HashMap<>();
    if (config.hasPath(CONFIG_PATH_OVERRIDES)) {
      for (Entry<String, ConfigValue> entry : config.getObject(CONFIG_PATH_OVERRIDES).entrySet()) {
        if (entry.getValue().valueType() != ConfigValueType.OBJECT) {
          throw new IllegalArgumentException(
              "Limits override for tenant " + entry.getKey() + " must be an object");
        }
        tenantOverrides.put(
            entry.getKey(),
            TenantLimits.fromConfig(
                ((ConfigObject) entry.getValue()).toConfig().withFallback(defaultsConfig)));
      }
    }
    this.overrides = Map.copyOf(tenantOverrides);
    log.info("Loaded limit overrides for {} tenant(s)", this.overrides.size());
  }

  @Override
  public TenantLimits forTenant(String tenantId) {
    return this.overrides.getOrDefault(tenantId, this.defaults);
  }
}
