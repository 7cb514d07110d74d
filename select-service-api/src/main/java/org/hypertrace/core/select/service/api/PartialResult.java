package org.hypertrace.core.select.service.api;

import lombok.NonNull;
import lombok.Value;

/** A fan-out answer together with the flag telling whether some storage nodes were missing. */
@Value(staticConstructor = "of")
public class PartialResult<T> {
  @NonNull T value;
  boolean partial;
}
