package org.hypertrace.core.select.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.hypertrace.core.select.service.FakeStorageBlock;
import org.hypertrace.core.select.service.api.MetricName;
import org.hypertrace.core.select.service.api.TimeRange;
import org.junit.jupiter.api.Test;

class ExportBlockTest {

  @Test
  void fillsRowsOfTheTimeRangeWithPlaceholderValues() {
    ExportBlock block = new ExportBlock();
    block.fill(
        MetricName.of("logs"), new FakeStorageBlock(100, 200, 300, 400), new TimeRange(150, 350));

    assertEquals(2, block.size());
    assertEquals(200, block.getTimestamp(0));
    assertEquals(300, block.getTimestamp(1));
    assertEquals(ExportBlock.PLACEHOLDER_VALUE, block.getValue(1));
    assertTrue(block.hasPayloads());
    assertArrayEquals("line-300".getBytes(StandardCharsets.UTF_8), block.getPayload(1));
  }

  @Test
  void reuseAfterResetStartsEmpty() {
    ExportBlock block = new ExportBlock();
    block.fill(MetricName.of("logs"), new FakeStorageBlock(1, 2, 3), new TimeRange(0, 10));
    block.reset();
    assertTrue(block.isEmpty());

    block.fill(MetricName.of("logs"), new FakeStorageBlock(5), new TimeRange(0, 10));
    assertEquals(1, block.size());
    assertEquals(5, block.getTimestamp(0));
  }
}
