package ca.gc.cra.pacer.config;

import ca.gc.cra.pacer.application.governor.GovernorSettings;
import ca.gc.cra.pacer.application.pipeline.PipelineSettings;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import ca.gc.cra.pacer.infrastructure.buffer.PriorityFrameStore;
import ca.gc.cra.pacer.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Governor and pipeline settings parsed from a flat key/value map.
 * <p>Recognized keys: {@code targetFrameRate}, {@code targetBudgetMs}, {@code maxMemoryMb}, {@code capacity},
 * {@code initialQuality}, {@code adaptiveQuality}, {@code resourceThrottling}, {@code performanceLogging},
 * {@code monitorIntervalMs}, {@code memorySampleIntervalMs}, {@code analysisWorkers}. Missing keys take their
 * defaults; unknown keys are ignored here.</p>
 *
 * @param governor governor settings
 * @param pipeline worker and monitor settings
 * @since PACER 0.1
 */
public record GovernorConfig(GovernorSettings governor, PipelineSettings pipeline) {
  static final long MAX_BUDGET_MS = 10_000L;
  static final long MAX_MEMORY_MB = 1_048_576L;
  static final long MAX_INTERVAL_MS = 3_600_000L;

  public GovernorConfig {
    Objects.requireNonNull(governor, "governor");
    Objects.requireNonNull(pipeline, "pipeline");
  }

  /**
   * Returns the defaults: 30 fps, 33 ms budget, 200 MiB, capacity 5, HIGH, all features on, four workers.
   *
   * @return default configuration
   */
  public static GovernorConfig defaults() {
    return new GovernorConfig(GovernorSettings.defaults(), PipelineSettings.defaults());
  }

  /**
   * Parses and validates a configuration map.
   *
   * @param kv flat key/value map; {@code null} means defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static GovernorConfig fromMap(Map<String, String> kv) {
    Map<String, String> map = kv == null ? Map.of() : kv;
    double targetFrameRate = Numbers.parseDouble(
        "targetFrameRate",
        map.get("targetFrameRate"),
        GovernorSettings.DEFAULT_TARGET_FRAME_RATE,
        0d,
        GovernorSettings.MAX_TARGET_FRAME_RATE);
    long budgetMs = Numbers.parseLong(
        "targetBudgetMs", map.get("targetBudgetMs"), GovernorSettings.DEFAULT_TARGET_BUDGET.toMillis(), 1,
        MAX_BUDGET_MS);
    long maxMemoryMb = Numbers.parseLong(
        "maxMemoryMb", map.get("maxMemoryMb"), GovernorSettings.DEFAULT_MAX_MEMORY_BYTES / (1024 * 1024), 1,
        MAX_MEMORY_MB);
    int capacity = (int) Numbers.parseLong(
        "capacity", map.get("capacity"), PriorityFrameStore.DEFAULT_CAPACITY, 1, GovernorSettings.MAX_CAPACITY);
    String rawQuality = map.get("initialQuality");
    QualityLevel initialQuality = rawQuality == null || rawQuality.isBlank()
        ? QualityStateMachine.INITIAL_LEVEL
        : QualityLevel.fromString(rawQuality);
    boolean adaptiveQuality = Numbers.parseBoolean("adaptiveQuality", map.get("adaptiveQuality"), true);
    boolean resourceThrottling = Numbers.parseBoolean("resourceThrottling", map.get("resourceThrottling"), true);
    boolean performanceLogging = Numbers.parseBoolean("performanceLogging", map.get("performanceLogging"), true);

    long monitorMs = Numbers.parseLong(
        "monitorIntervalMs", map.get("monitorIntervalMs"),
        PipelineSettings.DEFAULT_MONITOR_INTERVAL.toMillis(), 10, MAX_INTERVAL_MS);
    long memorySampleMs = Numbers.parseLong(
        "memorySampleIntervalMs", map.get("memorySampleIntervalMs"),
        PipelineSettings.DEFAULT_MEMORY_SAMPLE_INTERVAL.toMillis(), 10, MAX_INTERVAL_MS);
    int workers = (int) Numbers.parseLong(
        "analysisWorkers", map.get("analysisWorkers"), PipelineSettings.DEFAULT_WORKERS, 1,
        PipelineSettings.MAX_WORKERS);

    GovernorSettings governor = new GovernorSettings(
        targetFrameRate,
        Duration.ofMillis(budgetMs),
        maxMemoryMb * 1024 * 1024,
        capacity,
        initialQuality,
        adaptiveQuality,
        resourceThrottling,
        performanceLogging,
        Duration.ofMillis(memorySampleMs));
    PipelineSettings pipeline =
        new PipelineSettings(workers, Duration.ofMillis(monitorMs), Duration.ofMillis(memorySampleMs));
    return new GovernorConfig(governor, pipeline);
  }
}
