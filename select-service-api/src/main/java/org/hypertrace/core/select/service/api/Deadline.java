package org.hypertrace.core.select.service.api;

import java.time.Duration;
import java.time.Instant;
import lombok.EqualsAndHashCode;

/**
 * Advisory per request deadline. Storage clients check it between shard calls and fail with
 * {@link DeadlineExceededException} once it passes.
 */
@EqualsAndHashCode
public final class Deadline {
  private final Instant deadline;
  private final Duration timeout;
  private final String flagHint;

  private Deadline(Instant deadline, Duration timeout, String flagHint) {
    this.deadline = deadline;
    this.timeout = timeout;
    this.flagHint = flagHint;
  }

  /**
   * @param flagHint name of the setting that limits the timeout, included in error messages
   */
  public static Deadline after(Instant startTime, Duration timeout, String flagHint) {
    return new Deadline(startTime.plus(timeout), timeout, flagHint);
  }

  public Instant getDeadline() {
    return deadline;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public boolean exceeded(Instant now) {
    return now.isAfter(deadline);
  }

  public boolean exceeded() {
    return exceeded(Instant.now());
  }

  public Duration remaining(Instant now) {
    Duration remaining = Duration.between(now, deadline);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  @Override
  public String toString() {
    return String.format(
        "%.3f seconds (the timeout may be adjusted with `%s` setting)",
        timeout.toMillis() / 1000.0, flagHint);
  }
}
