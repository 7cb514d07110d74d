package org.hypertrace.core.select.service.format;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.Series;

/** Prometheus text exposition lines: {@code name{k="v"} value timestamp}. */
public final class PrometheusTextWriter {
  public static final String CONTENT_TYPE = "text/plain";

  private PrometheusTextWriter() {}

  public static void writeLine(OutputStream out, MetricName metricName, double value, long ts)
      throws IOException {
    StringBuilder sb = new StringBuilder(64);
    appendMetricName(sb, metricName);
    sb.append(' ').append(JsonFormats.formatValue(value)).append(' ').append(ts).append('\n');
    out.write(sb.toString().getBytes(StandardCharsets.UTF_8));
  }

  /** Federation only exposes the latest sample of a series; empty series are skipped. */
  public static void writeFederate(OutputStream out, Series series) throws IOException {
    if (series.isEmpty()) {
      return;
    }
    int last = series.size() - 1;
    writeLine(
        out, series.getMetricName(), series.getValues()[last], series.getTimestamps()[last]);
  }

  static void appendMetricName(StringBuilder sb, MetricName metricName) {
    sb.append(metricName.getMetricGroup());
    if (metricName.getTags().isEmpty()) {
      return;
    }
    sb.append('{');
    boolean first = true;
    for (MetricName.Tag tag : metricName.getTags()) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append(tag.getKey()).append("=\"");
      appendEscaped(sb, tag.getValue());
      sb.append('"');
    }
    sb.append('}');
  }

  private static void appendEscaped(StringBuilder sb, String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\':
          sb.append("\\\\");
          break;
        case '"':
          sb.append("\\\"");
          break;
        case '\n':
          sb.append("\\n");
          break;
        default:
          sb.append(c);
      }
    }
  }
}
