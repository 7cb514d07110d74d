package org.hypertrace.core.select.service.format;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import org.hypertrace.core.select.service.api.Series;

/**
 * Responses of the query endpoints. Log stream results use the {@code streams} result type with
 * nanosecond timestamps; numeric results follow the Prometheus HTTP API.
 */
public final class QueryResponseWriter {
  private static final String RESULT_TYPE_STREAMS = "streams";
  private static final String RESULT_TYPE_VECTOR = "vector";
  private static final String RESULT_TYPE_MATRIX = "matrix";

  private QueryResponseWriter() {}

  public static void writeStreams(OutputStream out, List<Series> series, boolean isPartial)
      throws IOException {
    try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
      writeEnvelopeStart(generator, RESULT_TYPE_STREAMS, isPartial);
      for (Series s : series) {
        writeStream(generator, s);
      }
      writeEnvelopeEnd(generator);
    }
  }

  /** Every series contributes its first point. */
  public static void writeVector(OutputStream out, List<Series> series, boolean isPartial)
      throws IOException {
    try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
      writeEnvelopeStart(generator, RESULT_TYPE_VECTOR, isPartial);
      for (Series s : series) {
        if (s.isEmpty()) {
          continue;
        }
        generator.writeStartObject();
        generator.writeFieldName("metric");
        JsonFormats.writeMetricName(generator, s.getMetricName());
        generator.writeFieldName("value");
        writeSample(generator, s.getTimestamps()[0], s.getValues()[0]);
        generator.writeEndObject();
      }
      writeEnvelopeEnd(generator);
    }
  }

  public static void writeMatrix(OutputStream out, List<Series> series, boolean isPartial)
      throws IOException {
    try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
      writeEnvelopeStart(generator, RESULT_TYPE_MATRIX, isPartial);
      for (Series s : series) {
        generator.writeStartObject();
        generator.writeFieldName("metric");
        JsonFormats.writeMetricName(generator, s.getMetricName());
        generator.writeArrayFieldStart("values");
        long[] timestamps = s.getTimestamps();
        double[] values = s.getValues();
        for (int i = 0; i < timestamps.length; i++) {
          writeSample(generator, timestamps[i], values[i]);
        }
        generator.writeEndArray();
        generator.writeEndObject();
      }
      writeEnvelopeEnd(generator);
    }
  }

  /** One message of a live tail. */
  public static void writeTail(OutputStream out, List<Series> series) throws IOException {
    try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
      generator.writeStartObject();
      generator.writeArrayFieldStart("streams");
      for (Series s : series) {
        writeStream(generator, s);
      }
      generator.writeEndArray();
      generator.writeArrayFieldStart("dropped_entries");
      generator.writeEndArray();
      generator.writeEndObject();
      generator.writeRaw('\n');
    }
  }

  private static void writeStream(JsonGenerator generator, Series series) throws IOException {
    generator.writeStartObject();
    generator.writeFieldName("stream");
    JsonFormats.writeMetricName(generator, series.getMetricName());
    generator.writeArrayFieldStart("values");
    long[] timestamps = series.getTimestamps();
    double[] values = series.getValues();
    byte[][] payloads = series.getPayloads();
    for (int i = 0; i < timestamps.length; i++) {
      generator.writeStartArray();
      JsonFormats.writeTimestampNanos(generator, timestamps[i]);
      if (payloads != null) {
        generator.writeUTF8String(payloads[i], 0, payloads[i].length);
      } else {
        generator.writeString(JsonFormats.formatValue(values[i]));
      }
      generator.writeEndArray();
    }
    generator.writeEndArray();
    generator.writeEndObject();
  }

  private static void writeSample(JsonGenerator generator, long timestamp, double value)
      throws IOException {
    generator.writeStartArray();
    JsonFormats.writeTimestampSeconds(generator, timestamp);
    generator.writeString(JsonFormats.formatValue(value));
    generator.writeEndArray();
  }

  private static void writeEnvelopeStart(
      JsonGenerator generator, String resultType, boolean isPartial) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("status", "success");
    generator.writeBooleanField("isPartial", isPartial);
    generator.writeObjectFieldStart("data");
    generator.writeStringField("resultType", resultType);
    generator.writeArrayFieldStart("result");
  }

  private static void writeEnvelopeEnd(JsonGenerator generator) throws IOException {
    generator.writeEndArray();
    generator.writeEndObject();
    generator.writeEndObject();
  }
}
