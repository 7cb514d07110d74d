package org.hypertrace.core.select.service.params;

import lombok.Value;

/** Resolved range of a range query, in milliseconds. */
@Value
public class TimeWindow {
  long start;
  long end;
  long step;

  public long getPoints() {
    return (end - start) / step + 1;
  }
}
