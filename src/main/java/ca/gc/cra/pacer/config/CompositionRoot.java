package ca.gc.cra.pacer.config;

import ca.gc.cra.pacer.application.governor.FrameGovernor;
import ca.gc.cra.pacer.application.pipeline.AnalysisPipeline;
import ca.gc.cra.pacer.application.pipeline.ReleaseTally;
import ca.gc.cra.pacer.application.port.ClockPort;
import ca.gc.cra.pacer.application.port.FrameAnalyzer;
import ca.gc.cra.pacer.application.port.MemoryProbePort;
import ca.gc.cra.pacer.application.port.MetricsPort;
import ca.gc.cra.pacer.infrastructure.memory.MemoryProbes;
import ca.gc.cra.pacer.infrastructure.synthetic.CountingResultSink;
import ca.gc.cra.pacer.infrastructure.synthetic.SyntheticFrame;
import ca.gc.cra.pacer.infrastructure.synthetic.SyntheticFrameSource;
import ca.gc.cra.pacer.infrastructure.synthetic.SyntheticLatencyAnalyzer;
import ca.gc.cra.pacer.infrastructure.time.SystemClockAdapter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wires the governor and the analysis pipeline from validated configuration.
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; each factory call builds a new graph.</p>
 *
 * @since PACER 0.1
 */
public final class CompositionRoot {
  private static final String[] ANALYZER_NAMES = {"exposure", "focus", "composition", "stability"};

  private final GovernorConfig governorConfig;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final MemoryProbePort memoryProbe;

  /**
   * Creates a root using the system clock and the best available memory probe.
   *
   * @param governorConfig governor and pipeline settings
   * @param metrics metrics sink shared by every component
   */
  public CompositionRoot(GovernorConfig governorConfig, MetricsPort metrics) {
    this(governorConfig, metrics, new SystemClockAdapter(), MemoryProbes.detect());
  }

  /**
   * Creates a root with explicit clock and memory probe.
   *
   * @param governorConfig governor and pipeline settings
   * @param metrics metrics sink
   * @param clock monotonic clock
   * @param memoryProbe resident memory probe
   */
  public CompositionRoot(
      GovernorConfig governorConfig, MetricsPort metrics, ClockPort clock, MemoryProbePort memoryProbe) {
    this.governorConfig = Objects.requireNonNull(governorConfig, "governorConfig");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
  }

  /**
   * Builds a synthetic load: a paced frame source, latency analyzers, and the governor between them.
   *
   * @param simulation synthetic load parameters
   * @return wired simulation
   */
  public Simulation simulation(SimulationConfig simulation) {
    Objects.requireNonNull(simulation, "simulation");
    ReleaseTally<SyntheticFrame> releases = new ReleaseTally<>();
    FrameGovernor<SyntheticFrame> governor =
        new FrameGovernor<>(governorConfig.governor(), clock, memoryProbe, metrics, releases);
    SyntheticFrameSource source = new SyntheticFrameSource(
        clock,
        simulation.sourceFps(),
        simulation.frames(),
        simulation.duration(),
        simulation.highPriorityEvery(),
        simulation.lowPriorityEvery());
    List<FrameAnalyzer<SyntheticFrame>> analyzers = new ArrayList<>(simulation.analyzers());
    for (int i = 0; i < simulation.analyzers(); i++) {
      String name = ANALYZER_NAMES[i % ANALYZER_NAMES.length]
          + (i < ANALYZER_NAMES.length ? "" : "-" + (i / ANALYZER_NAMES.length));
      analyzers.add(new SyntheticLatencyAnalyzer(
          name, simulation.analyzerLatency(), simulation.analyzerJitter(), simulation.seed() + i));
    }
    CountingResultSink sink = new CountingResultSink();
    AnalysisPipeline<SyntheticFrame> pipeline = new AnalysisPipeline<>(
        "simulate",
        source,
        analyzers,
        governor,
        sink,
        releases,
        metrics,
        clock,
        governorConfig.pipeline());
    return new Simulation(governor, pipeline, sink, releases);
  }

  /**
   * Wired synthetic load.
   *
   * @param governor governor under load
   * @param pipeline pipeline to run
   * @param results result counter
   * @param releases release counter shared by governor and pipeline
   */
  public record Simulation(
      FrameGovernor<SyntheticFrame> governor,
      AnalysisPipeline<SyntheticFrame> pipeline,
      CountingResultSink results,
      ReleaseTally<SyntheticFrame> releases) {}
}
