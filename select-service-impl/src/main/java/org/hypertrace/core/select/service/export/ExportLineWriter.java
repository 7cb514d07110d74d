package org.hypertrace.core.select.service.export;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import org.hypertrace.core.select.service.format.JsonFormats;
import org.hypertrace.core.select.service.format.PrometheusTextWriter;
import org.hypertrace.core.select.service.pipeline.ExportBlock;

/** Serializes one export line, i.e. the current window of an {@link ExportBlock}. */
@FunctionalInterface
public interface ExportLineWriter {

  void writeLine(ExportBlock line, OutputStream out) throws IOException;

  /**
   * {@code {"metric":{...},"values":[...],"timestamps":[...]}} followed by a newline. Values are
   * the raw payloads when the block carries them.
   */
  ExportLineWriter JSON_LINE =
      (line, out) -> {
        try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
          generator.writeStartObject();
          generator.writeFieldName("metric");
          JsonFormats.writeMetricName(generator, line.getMetricName());
          generator.writeArrayFieldStart("values");
          for (int i = 0; i < line.size(); i++) {
            if (line.hasPayloads()) {
              byte[] payload = line.getPayload(i);
              generator.writeUTF8String(payload, 0, payload.length);
            } else {
              JsonFormats.writeNumericValue(generator, line.getValue(i));
            }
          }
          generator.writeEndArray();
          generator.writeArrayFieldStart("timestamps");
          for (int i = 0; i < line.size(); i++) {
            generator.writeNumber(line.getTimestamp(i));
          }
          generator.writeEndArray();
          generator.writeEndObject();
          generator.writeRaw('\n');
        }
      };

  /** One exposition line per row. */
  ExportLineWriter PROMETHEUS =
      (line, out) -> {
        for (int i = 0; i < line.size(); i++) {
          PrometheusTextWriter.writeLine(
              out, line.getMetricName(), line.getValue(i), line.getTimestamp(i));
        }
      };

  /** A Prometheus HTTP API matrix element; the framer adds separators and the envelope. */
  ExportLineWriter PROMAPI =
      (line, out) -> {
        try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
          generator.writeStartObject();
          generator.writeFieldName("metric");
          JsonFormats.writeMetricName(generator, line.getMetricName());
          generator.writeArrayFieldStart("values");
          for (int i = 0; i < line.size(); i++) {
            generator.writeStartArray();
            JsonFormats.writeTimestampSeconds(generator, line.getTimestamp(i));
            generator.writeString(JsonFormats.formatValue(line.getValue(i)));
            generator.writeEndArray();
          }
          generator.writeEndArray();
          generator.writeEndObject();
        }
      };
}
