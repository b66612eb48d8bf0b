/**
 * Frame metadata carried through admission and buffering. Pixel data stays with the capture source.
 */
package ca.gc.cra.pacer.domain.frame;
