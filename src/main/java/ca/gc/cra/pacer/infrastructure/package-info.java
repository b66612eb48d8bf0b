/**
 * <strong>Purpose:</strong> Infrastructure adapters implementing PACER ports: buffering, clocks, memory probes,
 * executors, metrics, and synthetic capture/analysis for load simulation.
 * <p><strong>Pipeline role:</strong> Adapter layer wired by {@code config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Adapters document their own thread-safety.</p>
 * <p><strong>Observability:</strong> Adapters log through SLF4J and publish metrics via {@code MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.infrastructure;
