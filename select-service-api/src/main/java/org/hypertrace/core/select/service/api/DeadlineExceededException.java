package org.hypertrace.core.select.service.api;

public class DeadlineExceededException extends StorageException {

  public DeadlineExceededException(Deadline deadline) {
    super("the request didn't complete in " + deadline);
  }
}
