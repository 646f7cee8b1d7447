package org.hypertrace.core.query.frontend;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import org.hypertrace.core.query.frontend.api.IndexStatsHandler;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.client.LokiClientConfig;
import org.hypertrace.core.query.frontend.client.LokiRestClient;

public class QueryFrontendFactory {
  private static final String CONFIG_PATH_DOWNSTREAM = "downstream";

  /** Builds a frontend in front of the HTTP querier described by the {@code downstream} block. */
  public static QueryFrontend build(Config config, MeterRegistry meterRegistry) {
    LokiRestClient client =
        new LokiRestClient(new LokiClientConfig(config.getConfig(CONFIG_PATH_DOWNSTREAM)));
    return build(config, meterRegistry, client, client);
  }

  public static QueryFrontend build(
      Config config,
      MeterRegistry meterRegistry,
      QueryHandler downstreamHandler,
      IndexStatsHandler statsHandler) {
    return Guice.createInjector(
            new QueryFrontendModule(config, meterRegistry, downstreamHandler, statsHandler))
        .getInstance(QueryFrontend.class);
  }
}
