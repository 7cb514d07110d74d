package org.hypertrace.core.select.service.alignment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TailCursorTableTest {

  @Test
  void unknownSeriesHasNoCursor() {
    TailCursorTable table = new TailCursorTable();
    assertFalse(table.contains(42));
    assertEquals(Long.MIN_VALUE, table.getLastTimestamp(42));
  }

  @Test
  void evictsOnlyIdleCursors() {
    TailCursorTable table = new TailCursorTable();
    table.update(1, 1000);
    table.update(2, 5000);
    table.update(2, 9000);

    assertEquals(1, table.evictIdle(10_000, 5000));
    assertFalse(table.contains(1));
    assertTrue(table.contains(2));
    assertEquals(9000, table.getLastTimestamp(2));
    assertEquals(1, table.size());
  }
}
