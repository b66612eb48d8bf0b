/**
 * Rolling duration windows and the point-in-time performance snapshot.
 */
package ca.gc.cra.pacer.domain.metrics;
