package org.hypertrace.core.select.service;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.hypertrace.core.select.service.api.QueryEvaluator;
import org.hypertrace.core.select.service.api.SelectService;
import org.hypertrace.core.select.service.api.StorageClient;

public class SelectServiceFactory {
  private static final String SERVICE_NAME = "select-service";
  private static final String SELECT_SERVICE_CONFIG = "service.config";

  /** @param config application config holding {@code service.config} */
  public static SelectService build(
      Config config, StorageClient storageClient, QueryEvaluator queryEvaluator) {
    return build(config, storageClient, queryEvaluator, new SimpleMeterRegistry());
  }

  public static SelectService build(
      Config config,
      StorageClient storageClient,
      QueryEvaluator queryEvaluator,
      MeterRegistry meterRegistry) {
    return Guice.createInjector(
            new SelectServiceModule(
                config.getConfig(SELECT_SERVICE_CONFIG),
                storageClient,
                queryEvaluator,
                meterRegistry))
        .getInstance(SelectService.class);
  }

  public static String getServiceName() {
    return SERVICE_NAME;
  }
}
