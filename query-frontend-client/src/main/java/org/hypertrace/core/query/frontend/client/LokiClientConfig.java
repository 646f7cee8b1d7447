package org.hypertrace.core.query.frontend.client;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Config object describing the downstream query engine the frontend forwards requests to. */
public class LokiClientConfig {
  private static final Logger LOG = LoggerFactory.getLogger(LokiClientConfig.class);

  private static final String CONFIG_PATH_HOST = "host";
  private static final String CONFIG_PATH_PORT = "port";

  private final String host;
  private final int port;

  public LokiClientConfig(Config config) {
    LOG.info(config.toString());
    this.host = config.getString(CONFIG_PATH_HOST);
    this.port = config.getInt(CONFIG_PATH_PORT);
  }

  public String getHost() {
    return this.host;
  }

  public int getPort() {
    return port;
  }
}
