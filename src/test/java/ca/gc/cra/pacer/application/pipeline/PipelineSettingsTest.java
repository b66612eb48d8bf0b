package ca.gc.cra.pacer.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class PipelineSettingsTest {

  @Test
  void defaultsMatchMonitorCadence() {
    PipelineSettings settings = PipelineSettings.defaults();
    assertEquals(4, settings.analysisWorkers());
    assertEquals(Duration.ofSeconds(5), settings.monitorInterval());
    assertEquals(Duration.ofMillis(500), settings.memorySampleInterval());
  }

  @Test
  void rejectsOutOfRangeValues() {
    Duration second = Duration.ofSeconds(1);
    assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(0, second, second));
    assertThrows(IllegalArgumentException.class,
        () -> new PipelineSettings(PipelineSettings.MAX_WORKERS + 1, second, second));
    assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(1, Duration.ZERO, second));
    assertThrows(IllegalArgumentException.class, () -> new PipelineSettings(1, second, Duration.ofMillis(-5)));
    assertThrows(NullPointerException.class, () -> new PipelineSettings(1, null, second));
  }
}
