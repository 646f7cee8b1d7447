package org.hypertrace.core.query.frontend.admission;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import com.google.inject.multibindings.ProvidesIntoSet;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.hypertrace.core.query.frontend.QueryFrontendConfig;
import org.hypertrace.core.query.frontend.QueryMiddleware;
import org.hypertrace.core.query.frontend.admission.QuerySizeLimiter.Granularity;
import org.hypertrace.core.query.frontend.api.IndexStatsHandler;
import org.hypertrace.core.query.frontend.limits.LimitsSource;
import org.hypertrace.core.query.frontend.matchers.MatcherGroupExtractor;
import org.hypertrace.core.query.frontend.schema.SchemaTimeline;

public class AdmissionModule extends AbstractModule {

  @Override
  protected void configure() {
    Multibinder<QueryMiddleware> middlewareMultibinder =
        Multibinder.newSetBinder(binder(), QueryMiddleware.class);
    middlewareMultibinder.addBinding().to(QueryTimeRangeLimiter.class);
    middlewareMultibinder.addBinding().to(SeriesLimiter.class);
  }

  @ProvidesIntoSet
  @Singleton
  QueryMiddleware provideQuerySizeLimiter(
      QueryFrontendConfig config,
      LimitsSource limitsSource,
      SchemaTimeline schemaTimeline,
      IndexStatsHandler statsHandler,
      MatcherGroupExtractor matcherGroupExtractor,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new QuerySizeLimiter(
        Granularity.QUERY,
        limitsSource,
        schemaTimeline,
        statsHandler,
        matcherGroupExtractor,
        config.getMaxLookBackPeriod(),
        clock,
        meterRegistry);
  }

  @ProvidesIntoSet
  @Singleton
  QueryMiddleware provideQuerierSizeLimiter(
      QueryFrontendConfig config,
      LimitsSource limitsSource,
      SchemaTimeline schemaTimeline,
      IndexStatsHandler statsHandler,
      MatcherGroupExtractor matcherGroupExtractor,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new QuerySizeLimiter(
        Granularity.QUERIER,
        limitsSource,
        schemaTimeline,
        statsHandler,
        matcherGroupExtractor,
        config.getMaxLookBackPeriod(),
        clock,
        meterRegistry);
  }
}
