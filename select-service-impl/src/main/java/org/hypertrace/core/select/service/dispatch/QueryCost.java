package org.hypertrace.core.select.service.dispatch;

public class QueryCost {

  public static final QueryCost UNSUPPORTED = new QueryCost(-1);

  private final double cost;

  public QueryCost(double cost) {
    this.cost = cost;
  }

  /**
   * Return the cost of executing the query with a given shape.
   *
   * @return -1 when the shape does not apply, else 0 (cheapest) to 1 (full evaluation)
   */
  public double getCost() {
    return cost;
  }

  public boolean isSupported() {
    return cost >= 0;
  }
}
