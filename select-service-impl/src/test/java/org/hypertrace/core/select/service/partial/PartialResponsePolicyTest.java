package org.hypertrace.core.select.service.partial;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicBoolean;
import org.hypertrace.core.select.service.ClusterIncompleteException;
import org.junit.jupiter.api.Test;

class PartialResponsePolicyTest {
  private final PartialResponsePolicy policy = new PartialResponsePolicy();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  @Test
  void passesPartialResultsThroughByDefault() {
    assertDoesNotThrow(() -> policy.check(true, false, () -> cancelled.set(true)));
    assertFalse(cancelled.get());
  }

  @Test
  void passesCompleteResultsWhenDenied() {
    assertDoesNotThrow(() -> policy.check(false, true, () -> cancelled.set(true)));
    assertFalse(cancelled.get());
  }

  @Test
  void cancelsAndRejectsDeniedPartialResults() {
    assertThrows(
        ClusterIncompleteException.class,
        () -> policy.check(true, true, () -> cancelled.set(true)));
    assertTrue(cancelled.get());
  }

  @Test
  void rejectsDeniedPartialResultsAfterStreaming() {
    assertThrows(ClusterIncompleteException.class, () -> policy.checkAfterStreaming(true, true));
    assertDoesNotThrow(() -> policy.checkAfterStreaming(true, false));
  }
}
