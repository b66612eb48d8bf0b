package ca.gc.cra.pacer.application.port;

/**
 * <strong>What:</strong> Port abstracting PACER metrics emission.
 * <p><strong>Why:</strong> Allows the governor to record counters and latency observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like rejected, evicted, or dropped frames.</li>
 *   <li>Record numeric observations for analysis latency, memory usage, or drop percentages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the camera thread,
 * analyzer workers, and the monitor.</p>
 * <p><strong>Performance:</strong> Calls must be non-blocking and amortized O(1); they run on the camera thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code governor.analysis.durationNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code governor.frame.dropped}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
