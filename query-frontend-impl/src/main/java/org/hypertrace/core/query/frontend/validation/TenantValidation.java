package org.hypertrace.core.query.frontend.validation;

import io.grpc.Status;
import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryRequest;

class TenantValidation implements QueryValidation {
  @Override
  public Completable validate(QueryRequest queryRequest, QueryContext queryContext) {
    String tenantId = queryContext.getTenantId();
    if (tenantId == null || tenantId.isEmpty()) {
      return Completable.error(
          Status.INVALID_ARGUMENT.withDescription("Tenant ID is missing on request").asException());
    }
    return Completable.complete();
  }
}
