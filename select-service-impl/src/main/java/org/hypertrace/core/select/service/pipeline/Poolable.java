package org.hypertrace.core.select.service.pipeline;

/** An object that can be handed back to an {@link ObjectPool} and reused. */
public interface Poolable {

  /** Clears every reference and content so the object can be claimed again. */
  void reset();
}
