package org.hypertrace.core.select.service.pipeline;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/** A serialized response fragment. Oversized backing arrays are dropped on reset. */
public class ResultBuffer extends ByteArrayOutputStream implements Poolable {
  static final int INITIAL_CAPACITY = 1024;
  static final int MAX_RETAINED_CAPACITY = 1024 * 1024;

  public ResultBuffer() {
    super(INITIAL_CAPACITY);
  }

  /** Writes the content without the {@code IOException} wrapping of {@link #writeTo}. */
  public void copyTo(OutputStream out) throws IOException {
    out.write(buf, 0, count);
  }

  @Override
  public synchronized void reset() {
    super.reset();
    if (buf.length > MAX_RETAINED_CAPACITY) {
      buf = new byte[INITIAL_CAPACITY];
    }
  }

  int capacity() {
    return buf.length;
  }
}
