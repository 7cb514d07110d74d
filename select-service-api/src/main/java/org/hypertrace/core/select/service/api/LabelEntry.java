package org.hypertrace.core.select.service.api;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

@Value
public class LabelEntry {
  @NonNull String key;
  @NonNull List<String> values;
}
