package org.hypertrace.core.select.service.handler;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;
import com.google.inject.name.Names;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;

public class EndpointHandlerModule extends AbstractModule {
  public static final String TAIL_SCHEDULER = "tail";

  @Override
  protected void configure() {
    bind(Scheduler.class).annotatedWith(Names.named(TAIL_SCHEDULER)).toInstance(Schedulers.io());

    Multibinder<EndpointHandler> handlerMultibinder =
        Multibinder.newSetBinder(binder(), EndpointHandler.class);
    handlerMultibinder.addBinding().to(FederateHandler.class);
    handlerMultibinder.addBinding().to(ExportHandler.class);
    handlerMultibinder.addBinding().to(ExportNativeHandler.class);
    handlerMultibinder.addBinding().to(DeleteSeriesHandler.class);
    handlerMultibinder.addBinding().to(LabelValuesHandler.class);
    handlerMultibinder.addBinding().to(LabelsHandler.class);
    handlerMultibinder.addBinding().to(LabelsCountHandler.class);
    handlerMultibinder.addBinding().to(TsdbStatusHandler.class);
    handlerMultibinder.addBinding().to(SeriesCountHandler.class);
    handlerMultibinder.addBinding().to(SeriesHandler.class);
    handlerMultibinder.addBinding().to(QueryHandler.class);
    handlerMultibinder.addBinding().to(QueryRangeHandler.class);
    handlerMultibinder.addBinding().to(TailHandler.class);
  }
}
