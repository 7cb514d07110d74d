package org.hypertrace.core.select.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.reactivex.rxjava3.exceptions.CompositeException;
import java.io.IOException;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.api.SelectService;
import org.hypertrace.core.select.service.handler.EndpointHandlerRegistry;
import org.hypertrace.core.select.service.handler.EndpointHandlerRegistry.Route;
import org.hypertrace.core.select.service.validation.QueryValidator;

@Singleton
@Slf4j
class SelectServiceImpl implements SelectService {
  private static final String SERVICE_REQUESTS_STATUS_COUNTER = "select.service.requests.status";
  private static final String SERVICE_REQUEST_DURATION_TIMER = "select.service.request.duration";

  private final EndpointHandlerRegistry handlerRegistry;
  private final QueryValidator queryValidator;
  private final MeterRegistry meterRegistry;
  private final Counter requestStatusErrorCounter;
  private final Counter requestStatusSuccessCounter;

  @Inject
  SelectServiceImpl(
      EndpointHandlerRegistry handlerRegistry,
      QueryValidator queryValidator,
      MeterRegistry meterRegistry) {
    this.handlerRegistry = handlerRegistry;
    this.queryValidator = queryValidator;
    this.meterRegistry = meterRegistry;
    this.requestStatusErrorCounter =
        meterRegistry.counter(SERVICE_REQUESTS_STATUS_COUNTER, "error", "true");
    this.requestStatusSuccessCounter =
        meterRegistry.counter(SERVICE_REQUESTS_STATUS_COUNTER, "error", "false");
  }

  @Override
  public void handle(
      String path, RequestContext requestContext, SelectRequest request, ResponseSink sink)
      throws IOException {
    Timer.Sample sample = Timer.start(meterRegistry);
    String pathTemplate = "unknown";
    try {
      Route route =
          handlerRegistry
              .route(path, request)
              .orElseThrow(
                  () -> new RequestValidationException("unsupported path requested: " + path));
      pathTemplate = route.getHandler().getPath();
      validate(route.getRequest(), requestContext);
      route.getHandler().handle(requestContext, route.getRequest(), sink);
      requestStatusSuccessCounter.increment();
    } catch (IOException | RuntimeException e) {
      log.error("Request failed: path={}, {}", path, request, e);
      requestStatusErrorCounter.increment();
      throw e;
    } finally {
      sample.stop(meterRegistry.timer(SERVICE_REQUEST_DURATION_TIMER, "path", pathTemplate));
    }
  }

  private void validate(SelectRequest request, RequestContext requestContext) {
    try {
      queryValidator.validate(request, requestContext).blockingAwait();
    } catch (CompositeException e) {
      // every failed validation reports its own error; the first one is enough
      Throwable first = e.getExceptions().get(0);
      if (first instanceof RuntimeException) {
        throw (RuntimeException) first;
      }
      throw e;
    }
  }
}
