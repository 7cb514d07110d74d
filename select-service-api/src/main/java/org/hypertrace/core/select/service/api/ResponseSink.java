package org.hypertrace.core.select.service.api;

import java.io.IOException;
import java.io.OutputStream;

/** Transport side of a request: where the response headers and body go. */
public interface ResponseSink {

  void setContentType(String contentType);

  OutputStream getOutputStream() throws IOException;
}
