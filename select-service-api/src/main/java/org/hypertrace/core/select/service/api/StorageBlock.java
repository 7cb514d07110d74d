package org.hypertrace.core.select.service.api;

/** A raw, possibly still compressed block of samples for one series as kept by a storage node. */
public interface StorageBlock {

  /** Decodes the block contents; must be called before {@link #forEachRow}. */
  void unmarshalData() throws StorageException;

  /** Encodes the block in the portable native export format. */
  byte[] marshalPortable();

  /** Visits every decoded row that falls into the time range, in timestamp order. */
  void forEachRow(TimeRange timeRange, RowVisitor visitor);

  @FunctionalInterface
  interface RowVisitor {
    void accept(long timestamp, byte[] payload);
  }
}
