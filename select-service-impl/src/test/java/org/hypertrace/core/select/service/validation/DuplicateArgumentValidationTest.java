package org.hypertrace.core.select.service.validation;

import static org.hypertrace.core.select.service.SelectServiceTestUtils.request;

import io.reactivex.rxjava3.observers.TestObserver;
import java.time.Instant;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.RequestContext;
import org.junit.jupiter.api.Test;

class DuplicateArgumentValidationTest {
  RequestContext requestContext = new RequestContext(AuthToken.of(0, 0), Instant.EPOCH);
  DuplicateArgumentValidation validation = new DuplicateArgumentValidation();

  @Test
  void allowsRepeatedMatches() {
    TestObserver<Void> observer = new TestObserver<>();
    validation
        .validate(request("match[]", "up", "match[]", "down", "start", "1"), requestContext)
        .blockingSubscribe(observer);
    observer.assertComplete();
  }

  @Test
  void rejectsRepeatedSingleValuedArgs() {
    TestObserver<Void> observer = new TestObserver<>();
    validation
        .validate(request("query", "up", "step", "1m", "step", "5m"), requestContext)
        .blockingSubscribe(observer);
    observer.assertError(RequestValidationException.class);
  }
}
