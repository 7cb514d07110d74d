package org.hypertrace.core.select.service.api;

import java.time.Instant;
import lombok.NonNull;
import lombok.Value;

/**
 * Per request state shared by every stage: the tenant the request is scoped to and the time the
 * request was received. The receive time is the reference "current time" used for defaults.
 */
@Value
public class RequestContext {
  @NonNull AuthToken authToken;
  @NonNull Instant startTime;

  public long getCurrentTimeMillis() {
    return startTime.toEpochMilli();
  }
}
