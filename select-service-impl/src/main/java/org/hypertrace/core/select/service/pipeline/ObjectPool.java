package org.hypertrace.core.select.service.pipeline;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Unbounded pool of reusable objects shared by the fetch workers. An object is owned by exactly
 * one caller between {@link #claim()} and {@link #release}; at most {@code maxIdle} released
 * objects are retained.
 */
public class ObjectPool<T extends Poolable> {
  private final Queue<T> idle = new ConcurrentLinkedQueue<>();
  private final AtomicInteger idleCount = new AtomicInteger();
  private final Supplier<T> allocator;
  private final int maxIdle;

  public ObjectPool(Supplier<T> allocator, int maxIdle) {
    this.allocator = allocator;
    this.maxIdle = maxIdle;
  }

  public T claim() {
    T object = idle.poll();
    if (object == null) {
      return allocator.get();
    }
    idleCount.decrementAndGet();
    return object;
  }

  public void release(T object) {
    object.reset();
    if (idleCount.incrementAndGet() > maxIdle) {
      idleCount.decrementAndGet();
      return;
    }
    idle.offer(object);
  }

  int idleSize() {
    return idleCount.get();
  }
}
