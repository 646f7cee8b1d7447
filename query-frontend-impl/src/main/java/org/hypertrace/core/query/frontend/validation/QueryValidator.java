package org.hypertrace.core.query.frontend.validation;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.query.frontend.api.QueryContext;
import org.hypertrace.core.query.frontend.api.QueryRequest;

/**
 * Runs every registered validation and passes only if all of them complete. Validations run in no
 * particular order; a failing validation produces the error the caller receives.
 */
public class QueryValidator {
  private final Set<QueryValidation> validations;

  @Inject
  QueryValidator(Set<QueryValidation> validations) {
    this.validations = validations;
  }

  public Completable validate(QueryRequest request, QueryContext queryContext) {
    return Observable.fromIterable(validations)
        .flatMapCompletable(
            queryValidation -> queryValidation.validate(request, queryContext), true);
  }
}
