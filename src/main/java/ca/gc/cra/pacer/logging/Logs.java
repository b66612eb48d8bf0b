package ca.gc.cra.pacer.logging;

import java.util.Locale;

/**
 * <strong>What:</strong> Formatting helpers for durations, byte counts, and percentages in log lines.
 * <p><strong>Why:</strong> Keeps governor log output consistent ({@code 12.34 ms}, {@code 180.0 MiB}) across
 * components.
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final double NANOS_PER_MILLI = 1_000_000d;
  private static final double BYTES_PER_MIB = 1024d * 1024d;

  private Logs() {
    // Utility
  }

  /**
   * Formats nanoseconds as milliseconds with two decimals.
   *
   * @param nanos duration in nanoseconds
   * @return formatted value such as {@code "33.00 ms"}
   */
  public static String millis(long nanos) {
    return String.format(Locale.ROOT, "%.2f ms", nanos / NANOS_PER_MILLI);
  }

  /**
   * Formats a byte count in mebibytes with one decimal.
   *
   * @param bytes byte count
   * @return formatted value such as {@code "200.0 MiB"}
   */
  public static String mebibytes(long bytes) {
    return String.format(Locale.ROOT, "%.1f MiB", bytes / BYTES_PER_MIB);
  }

  /**
   * Formats a percentage with one decimal.
   *
   * @param percent value in percent
   * @return formatted value such as {@code "12.5%"}
   */
  public static String percent(double percent) {
    return String.format(Locale.ROOT, "%.1f%%", percent);
  }
}
