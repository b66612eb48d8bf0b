/**
 * Time-related infrastructure adapters implementing clock ports.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Performance:</strong> Nanosecond monotonic reads; minimal overhead.</p>
 */
package ca.gc.cra.pacer.infrastructure.time;
