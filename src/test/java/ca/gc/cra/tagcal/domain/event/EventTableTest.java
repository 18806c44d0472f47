package ca.gc.cra.tagcal.domain.event;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.domain.time.IndexRange;
import org.junit.jupiter.api.Test;

class EventTableTest {

  @Test
  void derivedColumnsDefaultFromRawAndCorrectedCoordinates() {
    EventTable table = EventTable.builder(
            new double[] {0, 1, 2}, new double[] {10, 11, 12}, new double[] {20, 21, 22})
        .column(EventColumn.XCORR, new double[] {30, 31, 32})
        .build();

    assertArrayEquals(new double[] {30, 31, 32}, table.column(EventColumn.XCORR));
    assertArrayEquals(new double[] {30, 31, 32}, table.column(EventColumn.XDOPP));
    assertArrayEquals(new double[] {30, 31, 32}, table.column(EventColumn.XFULL));
    assertArrayEquals(new double[] {20, 21, 22}, table.column(EventColumn.YCORR));
    assertArrayEquals(new double[] {20, 21, 22}, table.column(EventColumn.YFULL));
    assertArrayEquals(new int[] {0, 0, 0}, table.dq());
    assertArrayEquals(new double[] {1, 1, 1}, table.epsilon());
    assertFalse(table.hasPha());
  }

  @Test
  void derivedColumnsAreIndependentCopies() {
    EventTable table = EventTable.builder(new double[] {0}, new double[] {10}, new double[] {20}).build();

    table.column(EventColumn.XCORR)[0] = 99;

    assertEquals(10.0, table.column(EventColumn.XFULL)[0]);
    assertEquals(10.0, table.xraw(0));
  }

  @Test
  void lengthMismatchRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> EventTable.builder(new double[] {0, 1}, new double[] {1}, new double[] {1, 2}).build());
    assertTrue(ex.getMessage().contains("XRAW"));

    assertThrows(IllegalArgumentException.class,
        () -> EventTable.builder(new double[] {0}, new double[] {1}, new double[] {1})
            .pha(new int[] {1, 2})
            .build());
  }

  @Test
  void decreasingTimeRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> EventTable.builder(new double[] {0, 2, 1}, new double[3], new double[3]).build());
    assertTrue(ex.getMessage().contains("row 2"));
  }

  @Test
  void indexRangeIsHalfOpen() {
    EventTable table = EventTable.builder(
        new double[] {0, 1, 1, 2, 5}, new double[5], new double[5]).build();

    IndexRange range = table.indexRange(1, 2);

    assertEquals(1, range.from());
    assertEquals(3, range.to());
    assertTrue(table.indexRange(3, 4).isEmpty());
    assertEquals(5, table.indexRange(0, 10).size());
  }

  @Test
  void timeSnapshotDoesNotExposeStorage() {
    EventTable table = EventTable.builder(new double[] {0, 1}, new double[2], new double[2]).build();

    table.timeSnapshot()[0] = 7;

    assertEquals(0.0, table.time(0));
  }

  @Test
  void missingPhaColumnFailsOnAccess() {
    EventTable table = EventTable.empty();

    assertTrue(table.isEmpty());
    assertThrows(IllegalStateException.class, () -> table.pha(0));
  }
}
