package ca.gc.cra.pacer.domain.frame;

import java.util.Locale;

/**
 * Priority class attached to every captured frame.
 * <p>Shared by the admission layer and the frame store so both rank frames the same way.</p>
 *
 * @since PACER 0.1
 */
public enum FramePriority {
  /** Frames that may be discarded first, for example preview frames during fast motion. */
  LOW(0),
  /** Default class for regular preview frames. */
  NORMAL(1),
  /** Frames the host wants analyzed ahead of others, for example right after a focus tap. */
  HIGH(2);

  private final int rank;

  FramePriority(int rank) {
    this.rank = rank;
  }

  /**
   * Returns the numeric rank; higher ranks are served first and evicted last.
   *
   * @return rank in {@code [0, 2]}
   */
  public int rank() {
    return rank;
  }

  /**
   * Parses a priority name case-insensitively.
   *
   * @param raw priority name; {@code null} or blank yields {@link #NORMAL}
   * @return parsed priority
   * @throws IllegalArgumentException when the name is unknown
   */
  public static FramePriority fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return NORMAL;
    }
    try {
      return FramePriority.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("priority must be one of LOW, NORMAL, HIGH (was " + raw + ")", ex);
    }
  }
}
