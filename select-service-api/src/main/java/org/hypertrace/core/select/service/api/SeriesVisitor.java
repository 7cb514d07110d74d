package org.hypertrace.core.select.service.api;

import java.io.IOException;

@FunctionalInterface
public interface SeriesVisitor {

  /**
   * Called concurrently from the fetch workers, once per series.
   *
   * @param workerId id of the calling worker, in {@code [0, workers)}
   */
  void visit(Series series, int workerId) throws IOException;
}
