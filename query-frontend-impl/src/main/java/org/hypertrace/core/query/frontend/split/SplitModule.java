package org.hypertrace.core.query.frontend.split;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import org.hypertrace.core.query.frontend.QueryMiddleware;

public class SplitModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder.newSetBinder(binder(), QueryMiddleware.class)
        .addBinding()
        .to(SplitByIntervalMiddleware.class);
  }
}
