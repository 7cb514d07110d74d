package org.hypertrace.core.select.service.api;

import lombok.Value;

/** Inclusive millisecond time range. */
@Value
public class TimeRange {
  long minTimestamp;
  long maxTimestamp;

  public boolean contains(long timestamp) {
    return timestamp >= minTimestamp && timestamp <= maxTimestamp;
  }
}
