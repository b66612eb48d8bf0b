/**
 * Executor factories producing named threads for analyzer workers and the performance monitor.
 */
package ca.gc.cra.pacer.infrastructure.exec;
