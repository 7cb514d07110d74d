package org.hypertrace.core.select.service;

/**
 * Some storage nodes did not answer and the request does not accept a partial response. Nothing
 * is written to the transport before this error unless the response format streams data before
 * the completeness is known.
 */
public class ClusterIncompleteException extends SelectServiceException {
  public static final String MESSAGE =
      "cannot return full response, since some of storage nodes are unavailable";

  public ClusterIncompleteException() {
    super(MESSAGE);
  }
}
