package org.hypertrace.core.select.service.validation;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class QueryValidationModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<QueryValidation> validationMultibinder =
        Multibinder.newSetBinder(binder(), QueryValidation.class);
    validationMultibinder.addBinding().to(DuplicateArgumentValidation.class);
    validationMultibinder.addBinding().to(LimitValidation.class);
    validationMultibinder.addBinding().to(QueryLengthValidation.class);
  }
}
