package org.hypertrace.core.select.service.dispatch;

import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.select.service.api.Deadline;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.SelectRequest;

/** A resolved {@code /api/v1/query} request waiting to be dispatched to a shape. */
@Value
@Builder
public class InstantQuery {
  @NonNull SelectRequest request;
  @NonNull RequestContext context;
  @NonNull String query;
  long time;
  long step;
  long limit;
  boolean forward;
  long lookbackDelta;
  @NonNull Deadline deadline;
  boolean mayCache;
  boolean denyPartialResponse;
  RollupSugar rollupSugar;

  public Optional<RollupSugar> getRollupSugar() {
    return Optional.ofNullable(rollupSugar);
  }
}
