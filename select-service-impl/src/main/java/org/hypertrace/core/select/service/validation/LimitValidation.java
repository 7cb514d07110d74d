package org.hypertrace.core.select.service.validation;

import io.reactivex.rxjava3.core.Completable;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.SelectServiceConfig;
import org.hypertrace.core.select.service.SelectServiceConfig.LimitValidationConfig;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SelectRequest;
import org.hypertrace.core.select.service.params.RequestParams;

/** Checks an explicit {@code limit} argument against the configured range. */
@Slf4j
class LimitValidation implements QueryValidation {
  static final String ARG_LIMIT = "limit";

  private final LimitValidationConfig config;

  @Inject
  LimitValidation(SelectServiceConfig selectServiceConfig) {
    this.config = selectServiceConfig.getLimitValidationConfig();
  }

  @Override
  public Completable validate(SelectRequest request, RequestContext requestContext) {
    if (!request.hasFormValue(ARG_LIMIT)) {
      return Completable.complete();
    }
    return Completable.defer(() -> validateLimit(request));
  }

  private Completable validateLimit(SelectRequest request) {
    long limit = RequestParams.getInt64(request, ARG_LIMIT, 0);
    switch (config.getMode()) {
      case ERROR:
        if (isInvalidLimit(limit)) {
          return Completable.error(
              new RequestValidationException(generateErrorMessageForLimit(limit)));
        }
        return Completable.complete();

      case WARN:
        if (isInvalidLimit(limit)) {
          log.warn(
              generateErrorMessageForLimit(limit) + ". Allowing due to warn mode.{}{}",
              System.lineSeparator(),
              request);
        }
        return Completable.complete();
      case DISABLED:
      default:
        return Completable.complete();
    }
  }

  private String generateErrorMessageForLimit(long limit) {
    return String.format(
        "Received invalid query limit of %s, required to be in range of [%s, %s]",
        limit, config.getMin(), config.getMax());
  }

  private boolean isInvalidLimit(long limit) {
    return limit < config.getMin() || limit > config.getMax();
  }
}
