package org.hypertrace.core.select.service.dispatch;

import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class QueryShapeSelector {

  private static final Logger LOG = LoggerFactory.getLogger(QueryShapeSelector.class);

  private final Set<QueryShapeHandler> handlers;

  @Inject
  public QueryShapeSelector(Set<QueryShapeHandler> handlers) {
    this.handlers = handlers;
  }

  public Optional<QueryShapeHandler> select(InstantQuery query) {
    double minCost = Double.MAX_VALUE;
    QueryShapeHandler selectedHandler = null;
    for (QueryShapeHandler handler : handlers) {
      double cost = handler.canHandle(query).getCost();
      if (LOG.isDebugEnabled()) {
        LOG.debug("Query shape: {}, query cost: {}", handler.getName(), cost);
      }
      if (cost >= 0 && cost < minCost) {
        minCost = cost;
        selectedHandler = handler;
      }
    }

    if (selectedHandler != null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug(
            "Selected query shape: {} for the query: {}, cost: {}",
            selectedHandler.getName(),
            query.getQuery(),
            minCost);
      }
    } else {
      LOG.error("No query shape for the query: {}", query.getQuery());
    }
    return Optional.ofNullable(selectedHandler);
  }
}
