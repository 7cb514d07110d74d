package org.hypertrace.core.select.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.hypertrace.core.select.service.api.QueryEvaluator;
import org.hypertrace.core.select.service.api.SelectService;
import org.hypertrace.core.select.service.api.StorageClient;
import org.hypertrace.core.select.service.dispatch.DispatchModule;
import org.hypertrace.core.select.service.handler.EndpointHandlerModule;
import org.hypertrace.core.select.service.pipeline.StreamingResultPipeline;
import org.hypertrace.core.select.service.validation.QueryValidationModule;

public class SelectServiceModule extends AbstractModule {

  private final SelectServiceConfig config;
  private final StorageClient storageClient;
  private final QueryEvaluator queryEvaluator;
  private final MeterRegistry meterRegistry;

  public SelectServiceModule(
      Config config,
      StorageClient storageClient,
      QueryEvaluator queryEvaluator,
      MeterRegistry meterRegistry) {
    this.config = new SelectServiceConfig(config);
    this.storageClient = storageClient;
    this.queryEvaluator = queryEvaluator;
    this.meterRegistry = meterRegistry;
  }

  @Override
  protected void configure() {
    bind(SelectServiceConfig.class).toInstance(this.config);
    bind(StorageClient.class).toInstance(this.storageClient);
    bind(QueryEvaluator.class).toInstance(this.queryEvaluator);
    bind(MeterRegistry.class).toInstance(this.meterRegistry);
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(ExecutorService.class)
        .annotatedWith(Names.named(StreamingResultPipeline.FETCH_EXECUTOR))
        .toInstance(
            Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                    .setNameFormat("select-fetch-%d")
                    .setDaemon(true)
                    .build()));
    bind(SelectService.class).to(SelectServiceImpl.class);
    install(new DispatchModule());
    install(new EndpointHandlerModule());
    install(new QueryValidationModule());
  }
}
