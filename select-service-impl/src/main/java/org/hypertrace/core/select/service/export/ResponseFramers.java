package org.hypertrace.core.select.service.export;

import java.nio.charset.StandardCharsets;
import org.hypertrace.core.select.service.pipeline.ResponseFramer;

/** Envelopes for the streamed endpoints. */
public final class ResponseFramers {
  private static final byte[] COMMA = {','};

  private ResponseFramers() {}

  /** Fragments written back to back, as for line oriented formats. */
  public static ResponseFramer concatenated() {
    return (writer, fragments) -> fragments.forEach((fragment, index) -> writer.write(fragment));
  }

  public static ResponseFramer promApiMatrix(boolean isPartial) {
    return jsonArray(
        "{\"status\":\"success\",\"isPartial\":"
            + isPartial
            + ",\"data\":{\"resultType\":\"matrix\",\"result\":[",
        "]}}");
  }

  /** The metric names of the {@code /api/v1/series} endpoint. */
  public static ResponseFramer seriesList(boolean isPartial) {
    return jsonArray("{\"status\":\"success\",\"isPartial\":" + isPartial + ",\"data\":[", "]}");
  }

  private static ResponseFramer jsonArray(String prefix, String suffix) {
    byte[] prefixBytes = prefix.getBytes(StandardCharsets.UTF_8);
    byte[] suffixBytes = suffix.getBytes(StandardCharsets.UTF_8);
    return (writer, fragments) -> {
      writer.write(prefixBytes);
      fragments.forEach(
          (fragment, index) -> {
            if (index > 0) {
              writer.write(COMMA);
            }
            writer.write(fragment);
          });
      writer.write(suffixBytes);
    };
  }
}
