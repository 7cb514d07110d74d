package org.hypertrace.core.select.service.format;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.MetricName.Tag;
import org.hypertrace.core.select.service.api.Series;
import org.junit.jupiter.api.Test;

class QueryResponseWriterTest {
  private static final MetricName UP = MetricName.of("up", List.of(Tag.of("job", "a")));
  private static final MetricName WEB_LOGS = MetricName.of("", List.of(Tag.of("app", "web")));

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  @Test
  void writesMatrix() throws IOException {
    QueryResponseWriter.writeMatrix(
        out, List.of(Series.of(UP, new long[] {1000, 2000}, new double[] {1, 2.5})), false);

    assertEquals(
        "{\"status\":\"success\",\"isPartial\":false,\"data\":{\"resultType\":\"matrix\","
            + "\"result\":[{\"metric\":{\"__name__\":\"up\",\"job\":\"a\"},"
            + "\"values\":[[1,\"1\"],[2,\"2.5\"]]}]}}",
        written());
  }

  @Test
  void writesFirstPointOfEveryNonEmptySeriesAsVector() throws IOException {
    QueryResponseWriter.writeVector(
        out,
        List.of(
            Series.of(UP, new long[] {1500, 2000}, new double[] {7, 8}),
            Series.of(MetricName.of("down"), new long[0], new double[0])),
        true);

    assertEquals(
        "{\"status\":\"success\",\"isPartial\":true,\"data\":{\"resultType\":\"vector\","
            + "\"result\":[{\"metric\":{\"__name__\":\"up\",\"job\":\"a\"},"
            + "\"value\":[1.5,\"7\"]}]}}",
        written());
  }

  @Test
  void writesLogLinesAsStreams() throws IOException {
    QueryResponseWriter.writeStreams(out, List.of(logs(1, "GET /\"index\"")), false);

    assertEquals(
        "{\"status\":\"success\",\"isPartial\":false,\"data\":{\"resultType\":\"streams\","
            + "\"result\":[{\"stream\":{\"app\":\"web\"},"
            + "\"values\":[[\"1000000\",\"GET /\\\"index\\\"\"]]}]}}",
        written());
  }

  @Test
  void writesTailMessagePerLine() throws IOException {
    QueryResponseWriter.writeTail(out, List.of(logs(2, "hello")));

    assertEquals(
        "{\"streams\":[{\"stream\":{\"app\":\"web\"},\"values\":[[\"2000000\",\"hello\"]]}],"
            + "\"dropped_entries\":[]}\n",
        written());
  }

  private static Series logs(long timestamp, String line) {
    return Series.withPayloads(
        WEB_LOGS,
        new long[] {timestamp},
        new double[] {1},
        new byte[][] {line.getBytes(StandardCharsets.UTF_8)});
  }

  private String written() {
    return out.toString(StandardCharsets.UTF_8);
  }
}
