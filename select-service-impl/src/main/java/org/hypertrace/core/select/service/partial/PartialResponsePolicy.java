package org.hypertrace.core.select.service.partial;

import javax.inject.Singleton;
import org.hypertrace.core.select.service.ClusterIncompleteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens to a fan-out result some storage nodes did not contribute to. Partial
 * results are passed through unless the request denies them, in which case in-flight work is
 * cancelled and {@link ClusterIncompleteException} is raised.
 */
@Singleton
public class PartialResponsePolicy {
  private static final Logger LOG = LoggerFactory.getLogger(PartialResponsePolicy.class);

  /**
   * Called before anything is written.
   *
   * @param cancel releases the fetch work of the rejected result
   */
  public void check(boolean isPartial, boolean denyPartialResponse, Runnable cancel) {
    if (isPartial && denyPartialResponse) {
      cancel.run();
      LOG.debug("Rejecting partial response; fetch work cancelled");
      throw new ClusterIncompleteException();
    }
  }

  /**
   * Called when completeness is only known once the data has been streamed, as for block exports.
   */
  public void checkAfterStreaming(boolean isPartial, boolean denyPartialResponse) {
    if (isPartial && denyPartialResponse) {
      throw new ClusterIncompleteException();
    }
  }
}
