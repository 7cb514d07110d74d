package org.hypertrace.core.select.service.dispatch;

import java.util.Optional;
import lombok.NonNull;
import lombok.Value;

/**
 * The trailing {@code [window]} or {@code [window:step]} and optional {@code offset} of a query,
 * together with the query they apply to. Empty strings mean the part is absent.
 */
@Value
public class RollupSugar {
  @NonNull String childQuery;
  @NonNull String window;
  /** Null without a colon; empty for {@code [window:]}. */
  String step;
  @NonNull String offset;

  public boolean hasStep() {
    return step != null;
  }

  public Optional<String> getStep() {
    return Optional.ofNullable(step);
  }
}
