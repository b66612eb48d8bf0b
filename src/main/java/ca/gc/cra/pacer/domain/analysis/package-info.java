/**
 * Results produced by frame analyzers.
 */
package ca.gc.cra.pacer.domain.analysis;
