/**
 * Metrics adapters that bridge PACER ports to OpenTelemetry or no-op implementations.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Performance:</strong> Instruments are created once per key and cached; the camera thread only pays for
 * a map lookup and an SDK add.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code governor.*}, {@code pipeline.*}, and {@code monitor.*}
 * namespaces.</p>
 */
package ca.gc.cra.pacer.infrastructure.metrics;
