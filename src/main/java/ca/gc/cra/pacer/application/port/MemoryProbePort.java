package ca.gc.cra.pacer.application.port;

/**
 * <strong>What:</strong> Port reporting the process memory footprint.
 * <p><strong>Why:</strong> The throttling guard and the periodic monitor compare usage against a ceiling.</p>
 * <p><strong>Role:</strong> Application port implemented by platform-specific probes.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from the monitor thread and from
 * snapshot callers concurrently.</p>
 * <p><strong>Performance:</strong> May perform a small amount of I/O; never called on the camera thread.</p>
 * <p><strong>Observability:</strong> Failures are logged by implementations at DEBUG level.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.pacer.infrastructure.memory.MemoryProbes
 */
public interface MemoryProbePort {
  /**
   * Returns the resident memory of the current process.
   *
   * @return bytes in use; {@code 0} when the platform query fails. Never negative and never throws.
   */
  long residentMemoryBytes();
}
