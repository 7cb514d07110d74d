package org.hypertrace.core.select.service.alignment;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.Series;
import org.junit.jupiter.api.Test;

class PointAlignmentTest {
  private static final double NAN = Double.NaN;

  @Test
  void fastPathKeepsSeriesUntouched() {
    Series series = series("a", new long[] {1, 2, 3}, new double[] {1, 2, 3});
    double[] values = series.getValues();
    Series empty = series("b", new long[0], new double[0]);

    List<Series> result =
        PointAlignment.removeFilteredValuesAndTimeseries(List.of(series, empty), null);

    assertEquals(1, result.size());
    assertSame(series, result.get(0));
    assertSame(values, result.get(0).getValues());
  }

  @Test
  void nanValuesAreRemovedWithTheirPayloads() {
    Series series =
        Series.withPayloads(
            MetricName.of("logs"),
            new long[] {1, 2, 3, 4},
            new double[] {1, NAN, 3, NAN},
            new byte[][] {bytes("l1"), bytes("l2"), bytes("l3"), bytes("l4")});
    Series allNaN = series("b", new long[] {1, 2}, new double[] {NAN, NAN});

    List<Series> result =
        PointAlignment.removeFilteredValuesAndTimeseries(List.of(series, allNaN), null);

    assertEquals(1, result.size());
    Series pruned = result.get(0);
    assertArrayEquals(new long[] {1, 3}, pruned.getTimestamps());
    assertArrayEquals(new double[] {1, 3}, pruned.getValues());
    assertEquals(2, pruned.getPayloads().length);
    assertEquals("l3", new String(pruned.getPayloads()[1], StandardCharsets.UTF_8));
    for (double v : pruned.getValues()) {
      assertFalse(Double.isNaN(v));
    }
  }

  @Test
  void tailFilterDropsAlreadyEmittedPointsAndIsIdempotent() {
    Series series = series("a", new long[] {10, 20, 30, 40}, new double[] {1, 2, NAN, 4});
    Series other = series("b", new long[] {10, 20}, new double[] {1, 2});
    TailCursorTable filter = new TailCursorTable();
    filter.update(series.getMetricNameHash(), 20);

    List<Series> once =
        PointAlignment.removeFilteredValuesAndTimeseries(List.of(series, other), filter);
    assertEquals(2, once.size());
    assertArrayEquals(new long[] {40}, once.get(0).getTimestamps());
    assertArrayEquals(new long[] {10, 20}, once.get(1).getTimestamps());

    List<Series> twice = PointAlignment.removeFilteredValuesAndTimeseries(once, filter);
    assertEquals(2, twice.size());
    assertArrayEquals(new long[] {40}, twice.get(0).getTimestamps());
    assertArrayEquals(new double[] {4}, twice.get(0).getValues());
  }

  @Test
  void seriesFullyCoveredByCursorIsDropped() {
    Series series = series("a", new long[] {10, 20}, new double[] {1, 2});
    TailCursorTable filter = new TailCursorTable();
    filter.update(series.getMetricNameHash(), 20);
    assertTrue(PointAlignment.removeFilteredValuesAndTimeseries(List.of(series), filter).isEmpty());
  }

  @Test
  void trailingPointsTakeLastSettledValue() {
    Series series =
        series("a", new long[] {1000, 2000, 3000, 4000, 5000}, new double[] {1, 2, 3, 4, 5});

    PointAlignment.adjustLastPoints(List.of(series), 3000, 5000);

    assertArrayEquals(new double[] {1, 2, 3, 3, 3}, series.getValues());
  }

  @Test
  void trailingPointsWithoutSettledValueBecomeNaN() {
    Series series = series("a", new long[] {4000, 5000}, new double[] {4, 5});

    PointAlignment.adjustLastPoints(List.of(series), 3000, 6000);

    assertTrue(Double.isNaN(series.getValues()[0]));
    assertTrue(Double.isNaN(series.getValues()[1]));
  }

  @Test
  void offsetShiftedSeriesAreLeftAsIs() {
    double[] values = {1, 2, 3, 4, 5};
    Series series = series("a", new long[] {1000, 2000, 3000, 4000, 9000}, values.clone());

    PointAlignment.adjustLastPoints(List.of(series), 2000, 5000);

    assertArrayEquals(values, series.getValues());
  }

  @Test
  void pointsUpToUpperBoundAreReplaced() {
    Series series = series("a", new long[] {1000, 2000, 3000}, new double[] {1, 2, 3});

    PointAlignment.adjustLastPoints(List.of(series), 1000, 3000);
    assertArrayEquals(new double[] {1, 1, 1}, series.getValues());
  }

  private static Series series(String name, long[] timestamps, double[] values) {
    return Series.of(MetricName.of(name), timestamps, values);
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
