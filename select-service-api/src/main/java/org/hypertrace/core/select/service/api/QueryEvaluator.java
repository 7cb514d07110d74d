package org.hypertrace.core.select.service.api;

/**
 * Turns a query string into series for the time range, step and lookback carried by the {@link
 * EvalConfig}. Implementations own the query language; they are expected to honour {@link
 * EvalConfig#isDenyPartialResponse()} and report partial fan-out results otherwise.
 */
public interface QueryEvaluator {

  /**
   * @param firstPointOnly true for instant queries, where only the point at {@code start} matters
   * @throws StorageException when the query cannot be parsed or evaluated
   */
  EvaluationResult evaluate(EvalConfig config, String query, boolean firstPointOnly);
}
