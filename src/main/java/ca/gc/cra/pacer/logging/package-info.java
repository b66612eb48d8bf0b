/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and format governor values for log lines.
 * <p><strong>Pipeline role:</strong> Cross-cutting support for the governor, pipeline, and CLI.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent workers.
 * <p><strong>Performance:</strong> Lightweight string formatting and SLF4J level toggling.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.logging;
