package org.hypertrace.core.select.service.handler;

import java.io.IOException;
import org.hypertrace.core.select.service.api.RequestContext;
import org.hypertrace.core.select.service.api.ResponseSink;
import org.hypertrace.core.select.service.api.SelectRequest;

/** Serves one HTTP path of the select API. */
public interface EndpointHandler {

  /** The served path; segments in braces such as {@code {name}} bind path parameters. */
  String getPath();

  void handle(RequestContext context, SelectRequest request, ResponseSink sink)
      throws IOException;
}
