package org.hypertrace.core.select.service.alignment;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.hypertrace.core.select.service.api.Series;
import org.hypertrace.core.select.service.params.QueryParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live tail: polls the range {@code [start, now)} on a fixed interval and emits only points
 * that were not emitted before, until the row budget is used up.
 */
public class TailSession {
  private static final Logger LOG = LoggerFactory.getLogger(TailSession.class);

  private final TailPoller poller;
  private final TailCursorTable cursorTable = new TailCursorTable();
  private long start;
  private long remainingRows;

  public TailSession(long start, long limit, TailPoller poller) {
    this.start = start;
    this.remainingRows = limit;
    this.poller = poller;
  }

  /**
   * Runs a single poll ending at {@code now}.
   *
   * @return false once the row budget is exhausted
   */
  public boolean poll(long now) throws IOException {
    List<Series> result = poller.poll(start, now, remainingRows, cursorTable);
    for (Series series : result) {
      long lastTs = series.getLastTimestamp();
      if (lastTs > start) {
        start = lastTs;
      }
      cursorTable.update(series.getMetricNameHash(), lastTs);
      remainingRows -= series.size();
    }
    int evicted = cursorTable.evictIdle(now, QueryParameterResolver.DEFAULT_STEP_MILLIS);
    if (LOG.isDebugEnabled()) {
      LOG.debug(
          "Tail poll returned {} series; start: {}, remaining rows: {}, evicted cursors: {}",
          result.size(),
          start,
          remainingRows,
          evicted);
    }
    return remainingRows > 0;
  }

  /** Polls every {@code pollInterval}, starting immediately, until the budget is exhausted. */
  public void run(Duration pollInterval, Scheduler scheduler, LongSupplier clock)
      throws IOException {
    try {
      Observable.interval(0, pollInterval.toMillis(), TimeUnit.MILLISECONDS, scheduler)
          .map(tick -> poll(clock.getAsLong()))
          .takeUntil(hasBudget -> !hasBudget)
          .ignoreElements()
          .blockingAwait();
    } catch (RuntimeException e) {
      // blockingAwait wraps checked exceptions
      if (e.getClass() == RuntimeException.class && e.getCause() instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("interrupted while tailing");
      }
      if (e.getClass() == RuntimeException.class && e.getCause() instanceof IOException) {
        throw (IOException) e.getCause();
      }
      throw e;
    }
  }

  public long getStart() {
    return start;
  }

  public long getRemainingRows() {
    return remainingRows;
  }

  public TailCursorTable getCursorTable() {
    return cursorTable;
  }

  /** Executes one poll and writes its non-empty result; returns the series it emitted. */
  @FunctionalInterface
  public interface TailPoller {
    List<Series> poll(long start, long end, long limit, TailCursorTable filter) throws IOException;
  }
}
