package org.hypertrace.core.select.service.validation;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SelectRequest;

public interface QueryValidation {
  Completable validate(SelectRequest request, RequestContext requestContext);
}
