package org.hypertrace.core.select.service.export;

import java.util.Arrays;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.format.PrometheusTextWriter;
import org.hypertrace.core.select.service.pipeline.ResponseFramer;

public enum ExportFormat {
  JSON_LINES("", "application/stream+json", ExportLineWriter.JSON_LINE),
  PROMETHEUS("prometheus", PrometheusTextWriter.CONTENT_TYPE, ExportLineWriter.PROMETHEUS),
  PROMAPI("promapi", JsonFormats.CONTENT_TYPE_JSON, ExportLineWriter.PROMAPI);

  private final String argValue;
  private final String contentType;
  private final ExportLineWriter lineWriter;

  ExportFormat(String argValue, String contentType, ExportLineWriter lineWriter) {
    this.argValue = argValue;
    this.contentType = contentType;
    this.lineWriter = lineWriter;
  }

  /** Unknown values select the default JSON lines format. */
  public static ExportFormat fromArg(String format) {
    return Arrays.stream(values())
        .filter(value -> value.argValue.equals(format))
        .findFirst()
        .orElse(JSON_LINES);
  }

  public String getContentType() {
    return contentType;
  }

  public ExportLineWriter getLineWriter() {
    return lineWriter;
  }

  public ResponseFramer getFramer(boolean isPartial) {
    return this == PROMAPI
        ? ResponseFramers.promApiMatrix(isPartial)
        : ResponseFramers.concatenated();
  }
}
