package org.hypertrace.core.select.service.validation;

import io.reactivex.rxjava3.core.Completable;
import javax.inject.Inject;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.params.QueryParameterResolver;

class QueryLengthValidation implements QueryValidation {
  static final String ARG_QUERY = "query";

  private final QueryParameterResolver resolver;

  @Inject
  QueryLengthValidation(QueryParameterResolver resolver) {
    this.resolver = resolver;
  }

  @Override
  public Completable validate(SelectRequest request, RequestContext requestContext) {
    if (!request.hasFormValue(ARG_QUERY)) {
      return Completable.complete();
    }
    return Completable.fromAction(
        () -> resolver.checkQueryLength(request.getFormValue(ARG_QUERY)));
  }
}
