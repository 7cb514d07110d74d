package org.hypertrace.core.select.service.format;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.TagFilter;

/** JSON building blocks shared by every response format. */
public final class JsonFormats {
  public static final String CONTENT_TYPE_JSON = "application/json";
  private static final long NANOS_PER_MILLI = 1_000_000L;
  // fractional values outside [1e-4, 1e6) switch to exponent notation
  private static final int MIN_PLAIN_EXPONENT = -4;
  private static final int MAX_PLAIN_EXPONENT = 5;

  // generators never close or flush the transport; the response writer owns it
  private static final JsonFactory JSON_FACTORY =
      new JsonFactoryBuilder()
          .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
          .disable(StreamWriteFeature.FLUSH_PASSED_TO_STREAM)
          .build();
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper(JSON_FACTORY);

  private JsonFormats() {}

  public static JsonGenerator newGenerator(OutputStream out) throws IOException {
    return JSON_FACTORY.createGenerator(out);
  }

  public static ObjectMapper objectMapper() {
    return OBJECT_MAPPER;
  }

  /** Writes {@code {"__name__":"group","k":"v",...}}; an empty metric group is omitted. */
  public static void writeMetricName(JsonGenerator generator, MetricName metricName)
      throws IOException {
    generator.writeStartObject();
    if (!metricName.getMetricGroup().isEmpty()) {
      generator.writeStringField(TagFilter.METRIC_NAME_LABEL, metricName.getMetricGroup());
    }
    for (MetricName.Tag tag : metricName.getTags()) {
      generator.writeStringField(tag.getKey(), tag.getValue());
    }
    generator.writeEndObject();
  }

  /** Writes a unix timestamp in seconds with millisecond precision, e.g. {@code 1700000000.5}. */
  public static void writeTimestampSeconds(JsonGenerator generator, long timestampMillis)
      throws IOException {
    generator.writeNumber(
        BigDecimal.valueOf(timestampMillis, 3).stripTrailingZeros().toPlainString());
  }

  /** Log stream entries carry nanosecond timestamps as strings. */
  public static void writeTimestampNanos(JsonGenerator generator, long timestampMillis)
      throws IOException {
    generator.writeString(Long.toString(timestampMillis * NANOS_PER_MILLI));
  }

  /**
   * Formats a sample value the way the Prometheus text and HTTP formats expect: {@code NaN}, {@code
   * +Inf}, {@code -Inf}, integral values without a fraction, everything else in shortest form
   * with a two digit exponent for very small or large magnitudes, e.g. {@code 1e-05}.
   */
  public static String formatValue(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "+Inf" : "-Inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
    int exponent = decimal.precision() - decimal.scale() - 1;
    if (exponent >= MIN_PLAIN_EXPONENT && exponent <= MAX_PLAIN_EXPONENT) {
      return decimal.toPlainString();
    }
    return formatScientific(decimal, exponent);
  }

  /** {@code d.ddde+XX} with at least two exponent digits, e.g. {@code 1e-05}, {@code 1.5e+21}. */
  private static String formatScientific(BigDecimal decimal, int exponent) {
    String digits = decimal.unscaledValue().abs().toString();
    StringBuilder sb = new StringBuilder(digits.length() + 8);
    if (decimal.signum() < 0) {
      sb.append('-');
    }
    sb.append(digits.charAt(0));
    if (digits.length() > 1) {
      sb.append('.').append(digits, 1, digits.length());
    }
    sb.append('e').append(exponent < 0 ? '-' : '+');
    int absExponent = Math.abs(exponent);
    if (absExponent < 10) {
      sb.append('0');
    }
    return sb.append(absExponent).toString();
  }

  /** Writes the value as a JSON number, or as a string when JSON cannot represent it. */
  public static void writeNumericValue(JsonGenerator generator, double value) throws IOException {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      generator.writeString(formatValue(value));
    } else {
      generator.writeNumber(formatValue(value));
    }
  }
}
