package org.hypertrace.core.select.service.dispatch;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class DispatchModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<QueryShapeHandler> shapeMultibinder =
        Multibinder.newSetBinder(binder(), QueryShapeHandler.class);
    shapeMultibinder.addBinding().to(RawExportShapeHandler.class);
    shapeMultibinder.addBinding().to(RollupShapeHandler.class);
    shapeMultibinder.addBinding().to(EvaluatorShapeHandler.class);
  }
}
