package org.hypertrace.core.select.service;

/**
 * The request was rejected before contacting the storage nodes: a required argument is missing or
 * repeated, or a time, duration, number or selector cannot be parsed.
 */
public class RequestValidationException extends SelectServiceException {

  public RequestValidationException(String message) {
    super(message);
  }

  public RequestValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
