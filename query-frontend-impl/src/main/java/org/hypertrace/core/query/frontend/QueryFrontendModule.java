package org.hypertrace.core.query.frontend;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.multibindings.Multibinder;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import javax.inject.Singleton;
import org.hypertrace.core.query.frontend.admission.AdmissionModule;
import org.hypertrace.core.query.frontend.api.IndexStatsHandler;
import org.hypertrace.core.query.frontend.api.QueryHandler;
import org.hypertrace.core.query.frontend.limits.ConfigLimitsSource;
import org.hypertrace.core.query.frontend.limits.LimitsSource;
import org.hypertrace.core.query.frontend.limits.ReloadableLimitsSource;
import org.hypertrace.core.query.frontend.schema.SchemaTimeline;
import org.hypertrace.core.query.frontend.split.SplitModule;
import org.hypertrace.core.query.frontend.validation.QueryValidationModule;

class QueryFrontendModule extends AbstractModule {

  private final QueryFrontendConfig config;
  private final MeterRegistry meterRegistry;
  private final QueryHandler downstreamHandler;
  private final IndexStatsHandler statsHandler;

  QueryFrontendModule(
      Config config,
      MeterRegistry meterRegistry,
      QueryHandler downstreamHandler,
      IndexStatsHandler statsHandler) {
    this.config = new QueryFrontendConfig(config);
    this.meterRegistry = meterRegistry;
    this.downstreamHandler = downstreamHandler;
    this.statsHandler = statsHandler;
  }

  @Override
  protected void configure() {
    bind(QueryFrontendConfig.class).toInstance(this.config);
    bind(MeterRegistry.class).toInstance(this.meterRegistry);
    bind(QueryHandler.class).toInstance(this.downstreamHandler);
    bind(IndexStatsHandler.class).toInstance(this.statsHandler);
    bind(Scheduler.class).toInstance(Schedulers.io());
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(LimitsSource.class).to(ReloadableLimitsSource.class);
    Multibinder.newSetBinder(binder(), QueryMiddleware.class);
    install(new AdmissionModule());
    install(new SplitModule());
    install(new QueryValidationModule());
  }

  @Provides
  @Singleton
  SchemaTimeline provideSchemaTimeline() {
    return new SchemaTimeline(this.config.getSchemaPeriods());
  }

  @Provides
  @Singleton
  ReloadableLimitsSource provideLimitsSource() {
    return new ReloadableLimitsSource(new ConfigLimitsSource(this.config.getLimitsConfig()));
  }
}
