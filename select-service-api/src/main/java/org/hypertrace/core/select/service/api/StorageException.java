package org.hypertrace.core.select.service.api;

/** Failure reported by a storage collaborator. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
