package org.hypertrace.core.select.service.api;

import java.io.IOException;

/**
 * Handle to series fetched from the storage nodes. The series are decoded lazily by {@link
 * #runParallel}; a handle that is not consumed must be {@link #cancel() cancelled} so the fetch
 * workers release their resources.
 */
public interface SearchResults {

  /** True when at least one storage node did not answer in time. */
  boolean isPartial();

  int size();

  /**
   * Invokes the visitor for every series from a pool of workers and returns once all of them are
   * done. The first visitor error stops the remaining work and is rethrown.
   */
  void runParallel(SeriesVisitor visitor) throws IOException;

  void cancel();
}
