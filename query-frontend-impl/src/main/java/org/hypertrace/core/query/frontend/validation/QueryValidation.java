package org.hypertrace.core.query.frontend.validation;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryRequest;

public interface QueryValidation {
  Completable validate(QueryRequest queryRequest, QueryContext queryContext);
}
