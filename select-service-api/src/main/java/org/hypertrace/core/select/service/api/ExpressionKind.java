package org.hypertrace.core.select.service.api;

/** How the evaluator classified the root of an evaluated expression. */
public enum ExpressionKind {
  /** Log stream selectors and binary operations over them; rendered as streams. */
  STREAMS,
  /** Every other expression; rendered as a vector or matrix of samples. */
  VECTOR
}
