package org.hypertrace.core.select.service.dispatch;

import java.io.IOException;
import org.hypertrace.core.select.service.api.ResponseSink;

/**
 * One way of executing an instant query. Every handler reports the cost of serving a query;
 * the dispatcher runs the cheapest handler that supports it.
 */
public interface QueryShapeHandler {

  String getName();

  QueryCost canHandle(InstantQuery query);

  /** Executes the query and writes the whole response. */
  void handle(InstantQuery query, ResponseSink sink) throws IOException;
}
