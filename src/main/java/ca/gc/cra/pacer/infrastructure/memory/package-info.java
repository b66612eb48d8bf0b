/**
 * Memory probes implementing {@link ca.gc.cra.pacer.application.port.MemoryProbePort}.
 * <p><strong>Concurrency:</strong> Probes are stateless and thread-safe.</p>
 * <p><strong>Performance:</strong> Reads a small procfs file or a JMX bean; never called on the camera thread.</p>
 * <p><strong>Observability:</strong> Query failures are logged at DEBUG and reported as a zero reading.</p>
 */
package ca.gc.cra.pacer.infrastructure.memory;
