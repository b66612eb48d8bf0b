package ca.gc.cra.pacer.application.governor;

import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import ca.gc.cra.pacer.infrastructure.buffer.PriorityFrameStore;
import java.time.Duration;
import java.util.Objects;

/**
 * Tuning parameters for {@link FrameGovernor}.
 *
 * @param targetFrameRate frame rate the estimated analysis rate is capped at; {@code (0, 240]}
 * @param targetBudget per-analysis time budget driving adaptive quality and throttling; positive
 * @param maxMemoryBytes resident memory ceiling for throttling; positive
 * @param capacity frame store capacity; {@code [1, 1024]}
 * @param initialQuality quality level at startup
 * @param adaptiveQuality whether completed analyses adjust the quality level
 * @param resourceThrottling whether the throttling guard may reject frames
 * @param performanceLogging whether the aggregator logs the rolling average every 30 analyses
 * @param memorySampleInterval maximum age of the memory reading used by admission; positive
 * @since PACER 0.1
 */
public record GovernorSettings(
    double targetFrameRate,
    Duration targetBudget,
    long maxMemoryBytes,
    int capacity,
    QualityLevel initialQuality,
    boolean adaptiveQuality,
    boolean resourceThrottling,
    boolean performanceLogging,
    Duration memorySampleInterval) {

  public static final double DEFAULT_TARGET_FRAME_RATE = 30d;
  public static final Duration DEFAULT_TARGET_BUDGET = Duration.ofMillis(33);
  public static final long DEFAULT_MAX_MEMORY_BYTES = 200L * 1024 * 1024;
  public static final Duration DEFAULT_MEMORY_SAMPLE_INTERVAL = Duration.ofMillis(500);
  public static final double MAX_TARGET_FRAME_RATE = 240d;
  public static final int MAX_CAPACITY = 1024;

  /**
   * Validates the settings.
   *
   * @throws IllegalArgumentException when a value lies outside its documented range
   */
  public GovernorSettings {
    if (Double.isNaN(targetFrameRate) || targetFrameRate <= 0d || targetFrameRate > MAX_TARGET_FRAME_RATE) {
      throw new IllegalArgumentException(
          "targetFrameRate must be within (0, " + MAX_TARGET_FRAME_RATE + "] (was " + targetFrameRate + ")");
    }
    Objects.requireNonNull(targetBudget, "targetBudget");
    if (targetBudget.isNegative() || targetBudget.isZero()) {
      throw new IllegalArgumentException("targetBudget must be positive (was " + targetBudget + ")");
    }
    if (maxMemoryBytes <= 0) {
      throw new IllegalArgumentException("maxMemoryBytes must be positive (was " + maxMemoryBytes + ")");
    }
    if (capacity <= 0 || capacity > MAX_CAPACITY) {
      throw new IllegalArgumentException(
          "capacity must be between 1 and " + MAX_CAPACITY + " (was " + capacity + ")");
    }
    Objects.requireNonNull(initialQuality, "initialQuality");
    Objects.requireNonNull(memorySampleInterval, "memorySampleInterval");
    if (memorySampleInterval.isNegative() || memorySampleInterval.isZero()) {
      throw new IllegalArgumentException(
          "memorySampleInterval must be positive (was " + memorySampleInterval + ")");
    }
  }

  /**
   * Returns the default settings: 30 fps, 33 ms budget, 200 MiB ceiling, capacity 5, starting at HIGH, with
   * adaptive quality, throttling, and performance logging enabled, sampling memory at most every 500 ms.
   *
   * @return default settings
   */
  public static GovernorSettings defaults() {
    return new GovernorSettings(
        DEFAULT_TARGET_FRAME_RATE,
        DEFAULT_TARGET_BUDGET,
        DEFAULT_MAX_MEMORY_BYTES,
        PriorityFrameStore.DEFAULT_CAPACITY,
        QualityStateMachine.INITIAL_LEVEL,
        true,
        true,
        true,
        DEFAULT_MEMORY_SAMPLE_INTERVAL);
  }

  /**
   * Returns a copy with new runtime targets, keeping the feature toggles.
   *
   * @param frameRate new target frame rate
   * @param budget new analysis budget
   * @param memoryCeiling new memory ceiling in bytes
   * @param storeCapacity new frame store capacity
   * @return validated copy
   * @throws IllegalArgumentException when a value is out of range
   */
  public GovernorSettings withTargets(double frameRate, Duration budget, long memoryCeiling, int storeCapacity) {
    return new GovernorSettings(
        frameRate,
        budget,
        memoryCeiling,
        storeCapacity,
        initialQuality,
        adaptiveQuality,
        resourceThrottling,
        performanceLogging,
        memorySampleInterval);
  }
}
