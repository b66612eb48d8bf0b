package ca.gc.cra.pacer.domain.quality;

import java.time.Duration;
import java.util.Locale;

/**
 * Ordered quality levels trading analysis fidelity against throughput.
 * <p>Each level fixes the resolution frames are downsampled to before analysis, the number of analyses allowed
 * in flight, and the minimum spacing between two admitted frames. Declaration order is the level order.</p>
 *
 * @since PACER 0.1
 */
public enum QualityLevel {
  LOW(new Resolution(320, 240), 2, 10),
  MEDIUM(new Resolution(640, 480), 3, 15),
  HIGH(new Resolution(1280, 720), 4, 20),
  ULTRA(new Resolution(1920, 1080), 6, 30);

  private final Resolution targetResolution;
  private final int maxConcurrentAnalyzers;
  private final Duration minAnalysisInterval;

  QualityLevel(Resolution targetResolution, int maxConcurrentAnalyzers, int analysesPerSecond) {
    this.targetResolution = targetResolution;
    this.maxConcurrentAnalyzers = maxConcurrentAnalyzers;
    this.minAnalysisInterval = Duration.ofNanos(1_000_000_000L / analysesPerSecond);
  }

  public Resolution targetResolution() {
    return targetResolution;
  }

  public int maxConcurrentAnalyzers() {
    return maxConcurrentAnalyzers;
  }

  public Duration minAnalysisInterval() {
    return minAnalysisInterval;
  }

  /**
   * Returns the level one step above this one.
   *
   * @return next level, or this level when already {@link #ULTRA}
   */
  public QualityLevel higher() {
    QualityLevel[] levels = values();
    return ordinal() == levels.length - 1 ? this : levels[ordinal() + 1];
  }

  /**
   * Returns the level one step below this one.
   *
   * @return previous level, or this level when already {@link #LOW}
   */
  public QualityLevel lower() {
    return ordinal() == 0 ? this : values()[ordinal() - 1];
  }

  /**
   * Parses a level name case-insensitively.
   *
   * @param raw level name
   * @return parsed level
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static QualityLevel fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("quality level must not be blank");
    }
    try {
      return QualityLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "quality level must be one of LOW, MEDIUM, HIGH, ULTRA (was " + raw + ")", ex);
    }
  }
}
