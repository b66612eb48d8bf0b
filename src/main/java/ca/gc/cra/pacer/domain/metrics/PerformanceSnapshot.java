package ca.gc.cra.pacer.domain.metrics;

import ca.gc.cra.pacer.domain.quality.QualityLevel;
import java.time.Duration;
import java.util.Objects;

/**
 * Point-in-time view of governor performance.
 *
 * @param averageProcessingTime mean analysis duration over the snapshot window; {@link Duration#ZERO} when empty
 * @param estimatedFrameRate analyses per second implied by the average, capped at the target frame rate
 * @param droppedFramePercentage dropped frames as a percentage of frames seen
 * @param memoryUsageBytes resident memory reported by the probe; {@code 0} when unavailable
 * @param qualityLevel current quality level
 * @param throttling whether the throttling guard currently forces rejections
 * @param inFlight admitted analyses not yet completed
 * @param bufferedFrames frames waiting in the store
 * @param totalFrames frames seen since the last reset
 * @param droppedFrames frames dropped since the last reset
 * @param completedAnalyses analyses completed since the last reset
 * @since PACER 0.1
 */
public record PerformanceSnapshot(
    Duration averageProcessingTime,
    double estimatedFrameRate,
    double droppedFramePercentage,
    long memoryUsageBytes,
    QualityLevel qualityLevel,
    boolean throttling,
    int inFlight,
    int bufferedFrames,
    long totalFrames,
    long droppedFrames,
    long completedAnalyses) {

  public PerformanceSnapshot {
    Objects.requireNonNull(averageProcessingTime, "averageProcessingTime");
    Objects.requireNonNull(qualityLevel, "qualityLevel");
  }
}
