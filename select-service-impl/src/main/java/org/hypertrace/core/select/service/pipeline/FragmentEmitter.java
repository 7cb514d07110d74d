package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;

/** Producer side of a {@link StreamingResultPipeline}; used concurrently by the fetch workers. */
public interface FragmentEmitter {

  /** Fails once the transport reported an error, so workers stop early. */
  void checkWriter() throws IOException;

  /** Returns an empty pooled buffer owned by the caller until it is emitted. */
  ResultBuffer claim();

  /** Hands the buffer to the writer; blocks while the writer is behind. */
  void emit(ResultBuffer buffer) throws IOException;
}
