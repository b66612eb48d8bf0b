package ca.gc.cra.pacer.domain.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class QualityLevelTest {

  @Test
  void levelsCarryFixedParameters() {
    assertEquals(new Resolution(320, 240), QualityLevel.LOW.targetResolution());
    assertEquals(2, QualityLevel.LOW.maxConcurrentAnalyzers());
    assertEquals(Duration.ofMillis(100), QualityLevel.LOW.minAnalysisInterval());

    assertEquals(new Resolution(640, 480), QualityLevel.MEDIUM.targetResolution());
    assertEquals(3, QualityLevel.MEDIUM.maxConcurrentAnalyzers());
    assertEquals(Duration.ofNanos(66_666_666L), QualityLevel.MEDIUM.minAnalysisInterval());

    assertEquals(new Resolution(1280, 720), QualityLevel.HIGH.targetResolution());
    assertEquals(4, QualityLevel.HIGH.maxConcurrentAnalyzers());
    assertEquals(Duration.ofMillis(50), QualityLevel.HIGH.minAnalysisInterval());

    assertEquals(new Resolution(1920, 1080), QualityLevel.ULTRA.targetResolution());
    assertEquals(6, QualityLevel.ULTRA.maxConcurrentAnalyzers());
    assertEquals(Duration.ofNanos(33_333_333L), QualityLevel.ULTRA.minAnalysisInterval());
  }

  @Test
  void stepsStopAtTheEnds() {
    assertEquals(QualityLevel.LOW, QualityLevel.LOW.lower());
    assertEquals(QualityLevel.MEDIUM, QualityLevel.LOW.higher());
    assertEquals(QualityLevel.ULTRA, QualityLevel.ULTRA.higher());
    assertEquals(QualityLevel.HIGH, QualityLevel.ULTRA.lower());
    assertTrue(QualityLevel.LOW.compareTo(QualityLevel.ULTRA) < 0);
  }

  @Test
  void parsesNamesCaseInsensitively() {
    assertEquals(QualityLevel.MEDIUM, QualityLevel.fromString(" medium "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> QualityLevel.fromString("extreme"));
    assertTrue(ex.getMessage().contains("LOW, MEDIUM, HIGH, ULTRA"));
    assertThrows(IllegalArgumentException.class, () -> QualityLevel.fromString(" "));
  }

  @Test
  void downscaleFactorFitsSourceIntoTarget() {
    Resolution target = QualityLevel.MEDIUM.targetResolution();
    assertEquals(1d, target.downscaleFactor(320, 240));
    assertEquals(0.5d, target.downscaleFactor(1280, 960));
    assertEquals("640x480", target.toString());
    assertThrows(IllegalArgumentException.class, () -> new Resolution(0, 10));
  }
}
