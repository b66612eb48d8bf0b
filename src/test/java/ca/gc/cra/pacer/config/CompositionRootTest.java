package ca.gc.cra.pacer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pacer.application.pipeline.AnalysisPipeline.RunSummary;
import ca.gc.cra.pacer.config.CompositionRoot.Simulation;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.pacer.testing.FixedMemoryProbe;
import ca.gc.cra.pacer.testing.RecordingMetricsPort;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void wiresSyntheticLoadEndToEnd() throws Exception {
    GovernorConfig governorConfig = GovernorConfig.fromMap(Map.of(
        "initialQuality", "LOW",
        "analysisWorkers", "2",
        "adaptiveQuality", "false",
        "performanceLogging", "false"));
    SimulationConfig simulationConfig = SimulationConfig.fromMap(Map.of(
        "frames", "40",
        "sourceFps", "400",
        "analyzers", "2",
        "analyzerLatencyMs", "1",
        "analyzerJitterMs", "0"));
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    CompositionRoot root = new CompositionRoot(
        governorConfig, metrics, new SystemClockAdapter(), new FixedMemoryProbe(FixedMemoryProbe.mebibytes(10)));

    Simulation simulation = root.simulation(simulationConfig);
    assertEquals(QualityLevel.LOW, simulation.governor().qualityLevel());

    RunSummary summary = simulation.pipeline().run();

    assertEquals(40L, summary.framesOffered());
    assertTrue(summary.framesAnalyzed() > 0);
    assertEquals(summary.framesAnalyzed(), simulation.results().batches());
    assertEquals(summary.framesAnalyzed() * 2, simulation.results().results());
    assertEquals(40L, simulation.releases().total());
    assertEquals(summary.framesAnalyzed(), simulation.releases().count(ReleaseReason.CONSUMED));
    assertEquals(40, metrics.count("governor.frame.seen"));
  }
}
