package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;

/** Slices an export block into consecutive lines of at most {@code maxRowsPerLine} rows. */
public class RowsPerLineSplitter {

  private RowsPerLineSplitter() {}

  /**
   * Calls {@code consumer} once per line with the window of the block narrowed to that line. The
   * whole block is a single line, even an empty one, when {@code maxRowsPerLine <= 0}; otherwise an
   * empty block has no lines. The block window is restored before returning.
   */
  public static void forEachLine(ExportBlock block, int maxRowsPerLine, LineConsumer consumer)
      throws IOException {
    if (maxRowsPerLine <= 0) {
      consumer.accept(block);
      return;
    }
    if (block.size() <= maxRowsPerLine) {
      if (!block.isEmpty()) {
        consumer.accept(block);
      }
      return;
    }
    int from = block.getFrom();
    int to = block.getTo();
    try {
      for (int start = from; start < to; start += maxRowsPerLine) {
        block.setWindow(start, Math.min(start + maxRowsPerLine, to));
        consumer.accept(block);
      }
    } finally {
      block.setWindow(from, to);
    }
  }

  @FunctionalInterface
  public interface LineConsumer {
    void accept(ExportBlock line) throws IOException;
  }
}
