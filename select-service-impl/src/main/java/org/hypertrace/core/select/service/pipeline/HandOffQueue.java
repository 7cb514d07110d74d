package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Bounded queue between the fetch workers and the response writer. Producers block while it is
 * full. The producing side closes it once all items were put; the consuming side aborts it when it
 * stops reading, which fails blocked and future puts. Items still queued when it is aborted, or
 * handed off while the abort runs, go to the discard callback.
 */
class HandOffQueue<T> {
  private static final Object END = new Object();
  private static final long OFFER_TIMEOUT_MILLIS = 100;

  private final BlockingQueue<Object> queue;
  private final Consumer<? super T> discard;
  private volatile boolean aborted;

  HandOffQueue(int capacity, Consumer<? super T> discard) {
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.discard = discard;
  }

  void put(T item) throws IOException {
    offer(item);
  }

  /** Marks the end of the items. No-op once aborted. */
  void close() throws IOException {
    offer(END);
  }

  private void offer(Object item) throws IOException {
    try {
      while (!aborted) {
        if (queue.offer(item, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
          if (aborted) {
            discardQueued();
          }
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while handing off a result");
    }
    if (item != END) {
      throw new IOException("response writer stopped reading the results");
    }
  }

  /** Returns the next item, or null once the queue is closed and drained. */
  @Nullable
  @SuppressWarnings("unchecked")
  T take() throws InterruptedIOException {
    Object item;
    try {
      item = queue.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting for a result");
    }
    return item == END ? null : (T) item;
  }

  void abort() {
    aborted = true;
    discardQueued();
  }

  @SuppressWarnings("unchecked")
  private void discardQueued() {
    for (Object item = queue.poll(); item != null; item = queue.poll()) {
      if (item != END) {
        discard.accept((T) item);
      }
    }
  }

  boolean isAborted() {
    return aborted;
  }
}
