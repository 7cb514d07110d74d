package org.hypertrace.core.select.service.api;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Everything the expression evaluator needs to run a query. Immutable once built. */
@Value
@Builder(toBuilder = true)
public class EvalConfig {
  @NonNull AuthToken authToken;
  long start;
  long end;
  long step;
  long limit;
  boolean forward;
  @NonNull Deadline deadline;
  boolean mayCache;
  long lookbackDelta;
  boolean denyPartialResponse;
}
