package ca.gc.cra.pacer.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

import org.junit.jupiter.api.Test;

class NoOpMetricsAdapterTest {

  @Test
  void acceptsAnyKey() {
    try (NoOpMetricsAdapter adapter = new NoOpMetricsAdapter()) {
      assertDoesNotThrow(() -> adapter.increment("governor.frame.seen"));
      assertDoesNotThrow(() -> adapter.observe("monitor.memory.bytes", -1L));
    }
  }
}
