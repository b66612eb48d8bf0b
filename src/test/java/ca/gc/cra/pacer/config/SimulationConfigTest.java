package ca.gc.cra.pacer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.pacer.config.SimulationConfig.OutputFormat;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimulationConfigTest {

  @Test
  void defaultsRunForTenSeconds() {
    SimulationConfig config = SimulationConfig.fromMap(Map.of());

    assertEquals(30d, config.sourceFps());
    assertEquals(Duration.ofSeconds(10), config.duration());
    assertEquals(0L, config.frames());
    assertEquals(10, config.highPriorityEvery());
    assertEquals(3, config.lowPriorityEvery());
    assertEquals(3, config.analyzers());
    assertEquals(Duration.ofMillis(8), config.analyzerLatency());
    assertEquals(Duration.ofMillis(4), config.analyzerJitter());
    assertEquals(42L, config.seed());
    assertEquals(OutputFormat.TEXT, config.output());
  }

  @Test
  void frameLimitDropsDefaultDuration() {
    SimulationConfig config = SimulationConfig.fromMap(Map.of("frames", "120", "output", "JSON"));

    assertEquals(120L, config.frames());
    assertEquals(Duration.ZERO, config.duration());
    assertEquals(OutputFormat.JSON, config.output());
  }

  @Test
  void rejectsUnboundedRun() {
    assertThrows(IllegalArgumentException.class,
        () -> SimulationConfig.fromMap(Map.of("durationMs", "0")));
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.fromMap(Map.of("sourceFps", "0")));
    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.fromMap(Map.of("analyzers", "17")));
    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.fromMap(Map.of("output", "xml")));
    assertThrows(IllegalArgumentException.class, () -> SimulationConfig.fromMap(Map.of("seed", "abc")));
  }
}
