package org.hypertrace.core.select.service.api;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

@Value
public class EvaluationResult {
  @NonNull List<Series> series;
  @NonNull ExpressionKind kind;
  boolean partial;
}
