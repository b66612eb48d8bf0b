package ca.gc.cra.pacer.infrastructure.synthetic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntheticLatencyAnalyzerTest {

  @Test
  void latencyScalesWithResolution() {
    SyntheticLatencyAnalyzer analyzer =
        new SyntheticLatencyAnalyzer("focus", Duration.ofMillis(8), Duration.ZERO, 1L);

    assertEquals(Duration.ofMillis(8).toNanos(), analyzer.latencyFor(QualityLevel.HIGH));
    assertEquals(Duration.ofMillis(18).toNanos(), analyzer.latencyFor(QualityLevel.ULTRA));
    assertEquals(2_666_667L, analyzer.latencyFor(QualityLevel.MEDIUM));
    assertTrue(analyzer.latencyFor(QualityLevel.LOW) < analyzer.latencyFor(QualityLevel.MEDIUM));
  }

  @Test
  void analyzeDescribesTheWork() throws Exception {
    SyntheticLatencyAnalyzer analyzer =
        new SyntheticLatencyAnalyzer("exposure", Duration.ofMillis(1), Duration.ofMillis(1), 7L);
    SyntheticFrame frame = new SyntheticFrame(12, 1920, 1080, 555L);

    AnalysisResult result = analyzer.analyze(frame, QualityLevel.MEDIUM);

    assertEquals("exposure", result.analyzer());
    assertEquals(555L, result.frameTimestampNanos());
    assertEquals(QualityLevel.MEDIUM, result.quality());
    assertTrue(result.score() >= 0d && result.score() <= 1d);
    assertEquals(12L, result.attributes().get("sequence"));
    assertEquals("640x480", result.attributes().get("resolution"));
    assertEquals(1d / 3, (double) result.attributes().get("scale"), 1e-3);
  }

  @Test
  void sameSeedGivesSameScores() throws Exception {
    SyntheticFrame frame = new SyntheticFrame(1, 1920, 1080, 0L);
    SyntheticLatencyAnalyzer first = new SyntheticLatencyAnalyzer("a", Duration.ZERO, Duration.ZERO, 99L);
    SyntheticLatencyAnalyzer second = new SyntheticLatencyAnalyzer("a", Duration.ZERO, Duration.ZERO, 99L);

    assertEquals(
        List.of(first.analyze(frame, QualityLevel.LOW).score(), first.analyze(frame, QualityLevel.LOW).score()),
        List.of(second.analyze(frame, QualityLevel.LOW).score(), second.analyze(frame, QualityLevel.LOW).score()));
  }

  @Test
  void rejectsNegativeLatency() {
    assertThrows(IllegalArgumentException.class,
        () -> new SyntheticLatencyAnalyzer("x", Duration.ofMillis(-1), Duration.ZERO, 0L));
  }
}
