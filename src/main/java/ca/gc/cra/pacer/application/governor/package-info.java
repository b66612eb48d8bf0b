/**
 * <strong>Purpose:</strong> Frame admission and adaptive-quality governor.
 * <p><strong>Pipeline role:</strong> Sits between the frame producer and the analyzer pool; decides per frame
 * whether it is analyzed, buffered, or dropped.</p>
 * <p><strong>Concurrency:</strong> The frame store, admission state, metric windows, and adaptive window each have
 * their own lock so store mutation and metrics recording never contend. Counters are atomics.</p>
 * <p><strong>Performance:</strong> Every call made from the camera thread completes in bounded, sub-millisecond time.</p>
 * <p><strong>Observability:</strong> Publishes {@code governor.*} metrics and logs quality transitions.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.application.governor;
