package ca.gc.cra.pacer.application.governor;

import java.util.Locale;

/**
 * Outcome of one admission check, in the order the checks run.
 *
 * @since PACER 0.1
 */
public enum AdmissionDecision {
  /** The frame may be analyzed. */
  ADMITTED,
  /** Less than the quality level's minimum interval passed since the last admission. */
  TOO_SOON,
  /** The quality level's concurrency cap is reached. */
  AT_CAPACITY,
  /** The throttling guard forces rejection. */
  THROTTLED;

  /**
   * Indicates whether the frame was admitted.
   *
   * @return {@code true} only for {@link #ADMITTED}
   */
  public boolean admitted() {
    return this == ADMITTED;
  }

  /**
   * Returns the metric counter name for a rejection.
   *
   * @return dotted metric key, e.g. {@code governor.frame.rejected.too_soon}
   */
  String rejectionMetricKey() {
    return "governor.frame.rejected." + name().toLowerCase(Locale.ROOT);
  }
}
