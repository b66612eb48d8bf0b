/**
 * <strong>Purpose:</strong> Ports through which the governor talks to clocks, memory probes, capture sources,
 * analyzers, result sinks, and metrics backends.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters in {@code infrastructure} implement these.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Performance:</strong> Ports called from the camera thread must return in constant time.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.application.port;
