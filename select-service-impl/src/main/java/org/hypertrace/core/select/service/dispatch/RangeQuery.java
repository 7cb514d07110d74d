package org.hypertrace.core.select.service.dispatch;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.select.service.api.AuthToken;
import org.hypertrace.core.select.service.api.Deadline;

/**
 * A range query before range resolution. {@code ct} is the reference current time used for
 * hiding points that may not be visible yet; {@code tail} selects the live tail message format.
 */
@Value
@Builder(toBuilder = true)
public class RangeQuery {
  @NonNull AuthToken authToken;
  @NonNull String query;
  long start;
  long end;
  long step;
  long limit;
  boolean forward;
  long ct;
  @NonNull Deadline deadline;
  boolean mayCache;
  long lookbackDelta;
  boolean denyPartialResponse;
  boolean tail;
}
