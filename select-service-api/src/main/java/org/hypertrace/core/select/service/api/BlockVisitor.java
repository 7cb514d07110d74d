package org.hypertrace.core.select.service.api;

import java.io.IOException;

@FunctionalInterface
public interface BlockVisitor {

  /** Called concurrently from the fetch workers, once per raw block. */
  void visit(MetricName metricName, StorageBlock block, TimeRange timeRange) throws IOException;
}
