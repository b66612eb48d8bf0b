package ca.gc.cra.pacer.infrastructure.time;

import ca.gc.cra.pacer.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#nanoTime()}.
 *
 * @since PACER 0.1
 */
public final class SystemClockAdapter implements ClockPort {
  /**
   * Creates a system clock adapter.
   */
  public SystemClockAdapter() {}

  /**
   * Returns the JVM monotonic clock reading.
   *
   * @return nanoseconds from an arbitrary origin
   * @implNote Unaffected by wall-clock adjustments, unlike {@link System#currentTimeMillis()}.
   */
  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
