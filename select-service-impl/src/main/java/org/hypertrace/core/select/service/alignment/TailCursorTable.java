package org.hypertrace.core.select.service.alignment;

import java.util.HashMap;
import java.util.Map;

/**
 * Last emitted timestamp per series of a tailing session, keyed by the metric name hash. Owned by
 * a single session and not thread safe.
 */
public class TailCursorTable {
  private final Map<Long, Long> lastTimestamps = new HashMap<>();

  public boolean contains(long metricNameHash) {
    return lastTimestamps.containsKey(metricNameHash);
  }

  /** Returns the cursor of the series, or {@link Long#MIN_VALUE} when it has none. */
  public long getLastTimestamp(long metricNameHash) {
    return lastTimestamps.getOrDefault(metricNameHash, Long.MIN_VALUE);
  }

  public void update(long metricNameHash, long lastTimestamp) {
    lastTimestamps.put(metricNameHash, lastTimestamp);
  }

  /** Removes cursors that did not move for more than {@code maxIdleMillis} before {@code now}. */
  public int evictIdle(long now, long maxIdleMillis) {
    int sizeBefore = lastTimestamps.size();
    lastTimestamps.values().removeIf(lastTimestamp -> now - lastTimestamp > maxIdleMillis);
    return sizeBefore - lastTimestamps.size();
  }

  public int size() {
    return lastTimestamps.size();
  }
}
