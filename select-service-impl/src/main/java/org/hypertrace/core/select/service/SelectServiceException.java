package org.hypertrace.core.select.service;

/** Root of the errors the select service reports to its caller. */
public class SelectServiceException extends RuntimeException {

  public SelectServiceException(String message) {
    super(message);
  }

  public SelectServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
