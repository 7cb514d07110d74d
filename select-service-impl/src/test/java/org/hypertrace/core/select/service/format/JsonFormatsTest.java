package org.hypertrace.core.select.service.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.MetricName.Tag;
import org.junit.jupiter.api.Test;

class JsonFormatsTest {

  @Test
  void formatsSpecialAndIntegralValues() {
    assertEquals("NaN", JsonFormats.formatValue(Double.NaN));
    assertEquals("+Inf", JsonFormats.formatValue(Double.POSITIVE_INFINITY));
    assertEquals("-Inf", JsonFormats.formatValue(Double.NEGATIVE_INFINITY));
    assertEquals("3", JsonFormats.formatValue(3.0));
    assertEquals("-42", JsonFormats.formatValue(-42.0));
    assertEquals("1.5", JsonFormats.formatValue(1.5));
  }

  @Test
  void formatsSmallAndLargeMagnitudesWithExponent() {
    assertEquals("1e-05", JsonFormats.formatValue(0.00001));
    assertEquals("-2.5e-07", JsonFormats.formatValue(-0.00000025));
    assertEquals("0.0001", JsonFormats.formatValue(0.0001));
    assertEquals("123456.5", JsonFormats.formatValue(123456.5));
    assertEquals("1.2345675e+06", JsonFormats.formatValue(1234567.5));
    assertEquals("1e+15", JsonFormats.formatValue(1e15));
    assertEquals("1.5e+300", JsonFormats.formatValue(1.5e300));
  }

  @Test
  void writesTimestampsInSecondsWithMillisecondPrecision() throws IOException {
    assertEquals("1700000000.5", write(g -> JsonFormats.writeTimestampSeconds(g, 1700000000500L)));
    assertEquals("1", write(g -> JsonFormats.writeTimestampSeconds(g, 1000)));
    assertEquals("0.001", write(g -> JsonFormats.writeTimestampSeconds(g, 1)));
  }

  @Test
  void writesNanosecondTimestampsAsStrings() throws IOException {
    assertEquals("\"1500000000\"", write(g -> JsonFormats.writeTimestampNanos(g, 1500)));
  }

  @Test
  void omitsEmptyMetricGroup() throws IOException {
    assertEquals(
        "{\"__name__\":\"up\",\"job\":\"a\"}",
        write(
            g -> JsonFormats.writeMetricName(g, MetricName.of("up", List.of(Tag.of("job", "a"))))));
    MetricName withoutGroup = MetricName.of("", List.of(Tag.of("app", "web")));
    assertEquals("{\"app\":\"web\"}", write(g -> JsonFormats.writeMetricName(g, withoutGroup)));
  }

  @Test
  void writesNonFiniteNumbersAsStrings() throws IOException {
    assertEquals("\"NaN\"", write(g -> JsonFormats.writeNumericValue(g, Double.NaN)));
    assertEquals("2.25", write(g -> JsonFormats.writeNumericValue(g, 2.25)));
  }

  private static String write(GeneratorAction action) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator generator = JsonFormats.newGenerator(out)) {
      action.apply(generator);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  @FunctionalInterface
  private interface GeneratorAction {
    void apply(JsonGenerator generator) throws IOException;
  }
}
