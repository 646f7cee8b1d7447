package org.hypertrace.core.query.frontend.limits;

import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Limits source whose backing snapshot can be swapped at runtime. Readers never block; a request
 * that already captured its limits through {@link #forRequest} keeps them after a reload.
 */
@Slf4j
public class ReloadableLimitsSource implements LimitsSource {
  private final AtomicReference<LimitsSource> current;

  public ReloadableLimitsSource(LimitsSource initial) {
    this.current = new AtomicReference<>(initial);
  }

  @Override
  public TenantLimits forTenant(String tenantId) {
    return this.current.get().forTenant(tenantId);
  }

  public void reload(LimitsSource replacement) {
    this.current.set(replacement);
    log.info("Tenant limits reloaded");
  }
}
