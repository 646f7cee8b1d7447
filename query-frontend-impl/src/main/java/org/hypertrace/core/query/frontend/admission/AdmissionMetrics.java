package org.hypertrace.core.query.frontend.admission;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

final class AdmissionMetrics {
  private static final String REJECTIONS_COUNTER =
      "hypertrace.query.frontend.admission.rejections";
  private static final String MIDDLEWARE_TAG = "middleware";

  static Counter rejectionCounter(MeterRegistry meterRegistry, String middlewareName) {
    return Counter.builder(REJECTIONS_COUNTER)
        .description("Queries rejected before reaching the downstream handler")
        .tag(MIDDLEWARE_TAG, middlewareName)
        .register(meterRegistry);
  }

  private AdmissionMetrics() {}
}
