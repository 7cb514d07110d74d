package org.hypertrace.core.select.service.params;

import lombok.Value;

/**
 * Evaluation time of an instant query. {@code shift} is added to every returned timestamp when the
 * evaluation was moved back to hide points that are not visible yet.
 */
@Value
public class InstantTime {
  long evalTime;
  long shift;
}
