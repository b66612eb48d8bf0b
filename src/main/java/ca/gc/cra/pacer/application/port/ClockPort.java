package ca.gc.cra.pacer.application.port;

/**
 * <strong>What:</strong> Port supplying monotonic timestamps to admission and duration measurement.
 * <p><strong>Why:</strong> Lets tests drive admission intervals deterministically.</p>
 * <p><strong>Role:</strong> Application port consumed by the governor and the analysis pipeline.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; the camera thread and analyzer workers
 * read the clock concurrently.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote Default implementation delegates to {@link System#nanoTime()}.
 * @since 0.1.0
 * @see ca.gc.cra.pacer.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns a monotonic timestamp.
   *
   * @return nanoseconds from an arbitrary origin; only differences between readings are meaningful
   */
  long nanoTime();

  /**
   * Default {@link ClockPort} using {@link System#nanoTime()}.
   */
  ClockPort SYSTEM = System::nanoTime;
}
