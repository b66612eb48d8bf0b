package ca.gc.cra.pacer.domain.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RollingWindowTest {

  @Test
  void emptyWindowAveragesToZero() {
    RollingWindow window = new RollingWindow(3);
    assertEquals(0d, window.average());
    assertEquals(0d, window.averageOfLatest(2));
    assertEquals(0, window.size());
  }

  @Test
  void evictsOldestOnceFull() {
    RollingWindow window = new RollingWindow(3);
    window.add(10);
    window.add(20);
    window.add(30);
    assertTrue(window.isFull());
    assertEquals(20d, window.average());

    window.add(60);
    assertEquals(3, window.size());
    assertEquals(110d / 3, window.average(), 1e-9);
  }

  @Test
  void averageOfLatestUsesNewestSamples() {
    RollingWindow window = new RollingWindow(5);
    for (long value = 1; value <= 7; value++) {
      window.add(value);
    }
    assertEquals(6.5d, window.averageOfLatest(2));
    assertEquals(5d, window.averageOfLatest(10));
  }

  @Test
  void clearEmptiesWithoutChangingCapacity() {
    RollingWindow window = new RollingWindow(2);
    window.add(5);
    window.clear();
    assertFalse(window.isFull());
    assertEquals(0, window.size());
    assertEquals(2, window.capacity());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new RollingWindow(0));
  }
}
