package org.hypertrace.core.select.service.pipeline;

import java.io.IOException;

/** Writes the response envelope around the streamed fragments. */
@FunctionalInterface
public interface ResponseFramer {
  void writeResponse(BufferedResponseWriter writer, Fragments fragments) throws IOException;
}
