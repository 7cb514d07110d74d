package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;

/** Consumer side of a {@link StreamingResultPipeline}: the fragments in arrival order. */
public interface Fragments {

  /**
   * Passes every fragment to the visitor and returns its buffer to the pool afterwards. All the
   * fragments are consumed even when the visitor fails; the first failure is rethrown at the end.
   */
  void forEach(FragmentVisitor visitor) throws IOException;

  @FunctionalInterface
  interface FragmentVisitor {
    /** @param index zero based position of the fragment in the response */
    void visit(ResultBuffer fragment, int index) throws IOException;
  }
}
