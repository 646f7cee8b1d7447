package org.hypertrace.core.query.frontend.limits;

import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.RequestScopedKey;

/** Supplies the limits in effect for a tenant. Implementations must be safe for concurrent use. */
public interface LimitsSource {
  RequestScopedKey<TenantLimits> REQUEST_LIMITS = RequestScopedKey.named("tenant-limits");

  TenantLimits forTenant(String tenantId);

  /**
   * Limits of the request the context belongs to. The first lookup captures them, and every
   * sub-request of the same top-level request sees that snapshot even across a reload.
   */
  default TenantLimits forRequest(QueryContext context) {
    return context.computeIfAbsent(REQUEST_LIMITS, () -> this.forTenant(context.getTenantId()));
  }
}
