package org.hypertrace.core.select.service;

/** Evaluation or fetch failure, carrying the query and time range it happened for. */
public class QueryExecutionException extends SelectServiceException {

  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
