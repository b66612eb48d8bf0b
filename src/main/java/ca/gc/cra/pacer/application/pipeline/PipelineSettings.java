package ca.gc.cra.pacer.application.pipeline;

import ca.gc.cra.pacer.application.governor.GovernorSettings;
import java.time.Duration;
import java.util.Objects;

/**
 * Worker and monitor tuning for {@link AnalysisPipeline}.
 *
 * @param analysisWorkers number of analyzer worker threads
 * @param monitorInterval period of the performance snapshot and warnings
 * @param memorySampleInterval period of the background memory refresh, which keeps admission from reading the
 *     probe on the capture thread
 * @since PACER 0.1
 */
public record PipelineSettings(int analysisWorkers, Duration monitorInterval, Duration memorySampleInterval) {
  /** Upper bound on analyzer workers; the largest quality level allows six concurrent analyses. */
  public static final int MAX_WORKERS = 32;
  public static final int DEFAULT_WORKERS = 4;
  public static final Duration DEFAULT_MONITOR_INTERVAL = Duration.ofSeconds(5);
  public static final Duration DEFAULT_MEMORY_SAMPLE_INTERVAL = GovernorSettings.DEFAULT_MEMORY_SAMPLE_INTERVAL;

  public PipelineSettings {
    if (analysisWorkers <= 0 || analysisWorkers > MAX_WORKERS) {
      throw new IllegalArgumentException(
          "analysisWorkers must be between 1 and " + MAX_WORKERS + " (was " + analysisWorkers + ")");
    }
    requirePositive("monitorInterval", monitorInterval);
    requirePositive("memorySampleInterval", memorySampleInterval);
  }

  /**
   * Default tuning: four workers, 5 s snapshots, 500 ms memory sampling.
   *
   * @return defaults
   */
  public static PipelineSettings defaults() {
    return new PipelineSettings(DEFAULT_WORKERS, DEFAULT_MONITOR_INTERVAL, DEFAULT_MEMORY_SAMPLE_INTERVAL);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive (was " + value + ")");
    }
  }
}
