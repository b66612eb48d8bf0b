/**
 * Bounded frame buffering between the camera thread and analyzer workers.
 * <p><strong>Concurrency:</strong> Guarded by a per-store {@link java.util.concurrent.locks.ReentrantLock}.</p>
 * <p><strong>Performance:</strong> Linear scans over at most {@code capacity} entries per call.</p>
 */
package ca.gc.cra.pacer.infrastructure.buffer;
