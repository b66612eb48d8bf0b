/**
 * Use cases that drive the governor: the capture-to-analysis pipeline and its periodic performance monitor.
 * <p><strong>Concurrency:</strong> The capture loop runs on the caller's thread; analyzers run on a fixed worker
 * pool; the monitor runs on its own daemon scheduler.</p>
 * <p><strong>Observability:</strong> Sets the {@code pipeline} MDC key while running and emits
 * {@code pipeline.*} and {@code monitor.*} metrics.</p>
 */
package ca.gc.cra.pacer.application.pipeline;
