package org.hypertrace.core.select.service.pipeline;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import javax.annotation.Nullable;

/**
 * Buffered, thread safe transport writer. The first write error is kept and every later write is
 * skipped; the error is reported by {@link #checkError()}, {@link #flush()} and {@link #close()}.
 */
public class BufferedResponseWriter extends OutputStream {
  static final int BUFFER_SIZE = 64 * 1024;

  private final BufferedOutputStream out;
  @Nullable private IOException error;

  public BufferedResponseWriter(OutputStream out) {
    this.out = new BufferedOutputStream(out, BUFFER_SIZE);
  }

  @Override
  public synchronized void write(int b) {
    if (error != null) {
      return;
    }
    try {
      out.write(b);
    } catch (IOException e) {
      error = e;
    }
  }

  @Override
  public synchronized void write(byte[] b, int off, int len) {
    if (error != null) {
      return;
    }
    try {
      out.write(b, off, len);
    } catch (IOException e) {
      error = e;
    }
  }

  public synchronized void write(ResultBuffer buffer) {
    if (error != null) {
      return;
    }
    try {
      buffer.copyTo(out);
    } catch (IOException e) {
      error = e;
    }
  }

  /** Fails with the first write error, if any. */
  public synchronized void checkError() throws IOException {
    if (error != null) {
      throw error;
    }
  }

  @Override
  public synchronized void flush() throws IOException {
    checkError();
    try {
      out.flush();
    } catch (IOException e) {
      error = e;
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    flush();
  }
}
