package org.hypertrace.core.select.service.validation;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SelectRequest;

/**
 * Query validator invokes each registered validation, passing only if all complete successfully.
 * Validations may be performed in any order. Any failing validation is responsible for producing
 * its own error which will be passed to the caller.
 */
public class QueryValidator {
  private final Set<QueryValidation> validations;

  @Inject
  QueryValidator(Set<QueryValidation> validations) {
    this.validations = validations;
  }

  public Completable validate(SelectRequest request, RequestContext requestContext) {
    return Observable.fromIterable(validations)
        .flatMapCompletable(validation -> validation.validate(request, requestContext), true);
  }
}
