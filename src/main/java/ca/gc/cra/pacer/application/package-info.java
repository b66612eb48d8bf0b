/**
 * <strong>Purpose:</strong> Application layer: the frame governor and the analysis pipeline built around it.
 * <p><strong>Pipeline role:</strong> Orchestrates capture -> admission -> buffering -> analysis -> feedback.</p>
 * <p><strong>Concurrency:</strong> Components are shared by the camera thread, analyzer workers, and the monitor.</p>
 * <p><strong>Observability:</strong> Emits SLF4J logs and {@code MetricsPort} metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.application;
