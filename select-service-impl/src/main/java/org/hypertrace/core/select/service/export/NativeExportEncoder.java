package org.hypertrace.core.select.service.export;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.io.IOException;
import java.io.OutputStream;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.StorageBlock;

/**
 * Native export stream: the time range as two big endian int64 followed by one record per block,
 * each made of a length prefixed metric name and a length prefixed portable block. Lengths are big
 * endian uint32.
 */
public final class NativeExportEncoder {
  public static final String CONTENT_TYPE = "VictoriaMetrics/native";

  private NativeExportEncoder() {}

  public static void writeHeader(OutputStream out, long start, long end) throws IOException {
    out.write(Longs.toByteArray(start));
    out.write(Longs.toByteArray(end));
  }

  public static void writeRecord(OutputStream out, MetricName metricName, StorageBlock block)
      throws IOException {
    writeLengthPrefixed(out, metricName.marshalWithoutTenant());
    writeLengthPrefixed(out, block.marshalPortable());
  }

  private static void writeLengthPrefixed(OutputStream out, byte[] data) throws IOException {
    out.write(Ints.toByteArray(data.length));
    out.write(data);
  }
}
