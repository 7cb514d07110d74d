package org.hypertrace.core.select.service.pipeline;

import javax.inject.Singleton;

@Singleton
public class ResultBufferPool extends ObjectPool<ResultBuffer> {
  private static final int MAX_IDLE_BUFFERS = 4 * Runtime.getRuntime().availableProcessors();

  public ResultBufferPool() {
    super(ResultBuffer::new, MAX_IDLE_BUFFERS);
  }
}
