package org.hypertrace.core.query.frontend.validation;

import io.grpc.Status;
import io.reactivex.rxjava3.core.Completable;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.frontend.QueryFrontendConfig;
import org.hypertrace.core.query.frontend.QueryFrontendConfig.LimitValidationConfig;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryRequest;

/** Checks the requested entry limit of a query against the configured range. */
@Slf4j
class LimitValidation implements QueryValidation {

  private final LimitValidationConfig config;

  @Inject
  LimitValidation(QueryFrontendConfig queryFrontendConfig) {
    this.config = queryFrontendConfig.getLimitValidationConfig();
  }

  @Override
  public Completable validate(QueryRequest queryRequest, QueryContext queryContext) {
    if (!isInvalidLimit(queryRequest.getLimit())) {
      return Completable.complete();
    }
    switch (config.getMode()) {
      case ERROR:
        return Completable.error(
            Status.INVALID_ARGUMENT
                .withDescription(errorMessageForLimit(queryRequest.getLimit()))
                .asException());
      case WARN:
        log.warn(
            "{}. Allowing due to warn mode. Tenant: {}, query: {}",
            errorMessageForLimit(queryRequest.getLimit()),
            queryContext.getTenantId(),
            queryRequest.getQuery());
        return Completable.complete();
      case DISABLED:
      default:
        return Completable.complete();
    }
  }

  private String errorMessageForLimit(int limit) {
    return String.format(
        "Received invalid query limit of %s, required to be in range of [%s, %s]",
        limit, config.getMin(), config.getMax());
  }

  private boolean isInvalidLimit(int limit) {
    return limit < config.getMin() || limit > config.getMax();
  }
}
