package org.hypertrace.core.query.frontend.schema;

import java.util.Arrays;

/** Index store serving a schema period. Only {@link #TSDB} answers index statistics lookups. */
public enum IndexType {
  TSDB("tsdb"),
  BOLTDB_SHIPPER("boltdb-shipper"),
  BIGTABLE("bigtable");

  private final String configName;

  IndexType(String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  public static IndexType fromConfigName(String configName) {
    return Arrays.stream(values())
        .filter(indexType -> indexType.configName.equals(configName))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Unsupported index type: " + configName));
  }
}
