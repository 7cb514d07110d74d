package org.hypertrace.core.select.service.dispatch;

import java.io.IOException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.select.service.QueryExecutionException;
import org.hypertrace.core.select.service.api.ResponseSink;

/** Runs an instant query through the cheapest shape that can serve it. */
@Singleton
public class QueryDispatcher {
  private final QueryShapeSelector selector;

  @Inject
  public QueryDispatcher(QueryShapeSelector selector) {
    this.selector = selector;
  }

  public void dispatch(InstantQuery query, ResponseSink sink) throws IOException {
    QueryShapeHandler handler =
        selector
            .select(query)
            .orElseThrow(
                () ->
                    new QueryExecutionException(
                        "No query shape available for query=" + query.getQuery()));
    handler.handle(query, sink);
  }
}
