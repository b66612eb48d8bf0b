/**
 * Synthetic capture and analysis adapters used by the {@code simulate} command to load the governor without a
 * camera.
 */
package ca.gc.cra.pacer.infrastructure.synthetic;
