package org.hypertrace.core.select.service.params;

import static org.hypertrace.core.select.service.SelectServiceTestUtils.request;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.hypertrace.core.select.service.RequestValidationException;
import org.hypertrace.core.select.service.api.Deadline;
import org.junit.jupiter.api.Test;

class RequestParamsTest {

  @Test
  void getTimeParsesSecondsAndRfc3339() {
    assertEquals(1500, RequestParams.getTime(request("start", "1.5"), "start", 0));
    assertEquals(
        1577836800000L,
        RequestParams.getTime(request("start", "2020-01-01T00:00:00Z"), "start", 0));
    assertEquals(42, RequestParams.getTime(request(), "start", 42));
  }

  @Test
  void getTimeClamps() {
    assertEquals(0, RequestParams.getTime(request("start", "-100"), "start", 7));
    assertEquals(
        RequestParams.MAX_TIME_MILLIS, RequestParams.getTime(request("end", "1e20"), "end", 7));
  }

  @Test
  void getTimeRejectsGarbage() {
    assertThrows(
        RequestValidationException.class,
        () -> RequestParams.getTime(request("start", "yesterday"), "start", 0));
  }

  @Test
  void getDurationRange() {
    assertEquals(60_000, RequestParams.getDuration(request("step", "1m"), "step", 0));
    assertEquals(15_000, RequestParams.getDuration(request("step", "15"), "step", 0));
    assertThrows(
        RequestValidationException.class,
        () -> RequestParams.getDuration(request("step", "0"), "step", 0));
    assertThrows(
        RequestValidationException.class,
        () -> RequestParams.getDuration(request("step", "101y"), "step", 0));
  }

  @Test
  void getBool() {
    for (String value : List.of("0", "f", "false", "no", "FALSE")) {
      assertFalse(RequestParams.getBool(request("nocache", value), "nocache"), value);
    }
    assertFalse(RequestParams.getBool(request(), "nocache"));
    assertTrue(RequestParams.getBool(request("nocache", "1"), "nocache"));
    assertTrue(RequestParams.getBool(request("nocache", "yes"), "nocache"));
  }

  @Test
  void getInt64() {
    assertEquals(1000, RequestParams.getInt64(request(), "limit", 1000));
    assertEquals(5, RequestParams.getInt64(request("limit", "5"), "limit", 1000));
    assertThrows(
        RequestValidationException.class,
        () -> RequestParams.getInt64(request("limit", "five"), "limit", 1000));
  }

  @Test
  void getMatches() {
    assertEquals(
        List.of("a", "b"),
        RequestParams.getMatches(request("match[]", "a", "match[]", "b"), false));
    assertEquals(List.of("c"), RequestParams.getMatches(request("match", "c"), true));
    assertThrows(
        RequestValidationException.class,
        () -> RequestParams.getMatches(request("match", "c"), false));
  }

  @Test
  void deadlineIsCapped() {
    Instant start = Instant.ofEpochMilli(10_000);
    Deadline capped =
        RequestParams.getDeadline(request("timeout", "1h"), start, Duration.ofSeconds(30), "flag");
    assertEquals(Duration.ofSeconds(30), capped.getTimeout());
    Deadline shorter =
        RequestParams.getDeadline(request("timeout", "5s"), start, Duration.ofSeconds(30), "flag");
    assertEquals(Instant.ofEpochMilli(15_000), shorter.getDeadline());
  }
}
