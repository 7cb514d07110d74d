package org.hypertrace.core.select.service;

public class QueryTooLongException extends RequestValidationException {
  private final int length;
  private final int limit;

  public QueryTooLongException(int length, int limit) {
    super(
        String.format(
            "too long query; got %d bytes; mustn't exceed `search.maxQueryLen=%d` bytes",
            length, limit));
    this.length = length;
    this.limit = limit;
  }

  public int getLength() {
    return length;
  }

  public int getLimit() {
    return limit;
  }
}
