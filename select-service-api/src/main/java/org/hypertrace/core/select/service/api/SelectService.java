package org.hypertrace.core.select.service.api;

import java.io.IOException;

/**
 * Entry point used by the transport. Routes the request to the endpoint registered for the path
 * and streams the response into the sink.
 *
 * <p>Failures are reported as unchecked exceptions rooted at the service's exception hierarchy;
 * transport failures are reported as {@link IOException}s.
 */
public interface SelectService {

  void handle(String path, RequestContext requestContext, SelectRequest request, ResponseSink sink)
      throws IOException;
}
