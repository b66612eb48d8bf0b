/**
 * Quality levels and the single-step state machine that moves between them.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.pacer.domain.quality.QualityStateMachine} is lock-free and
 * safe for concurrent readers and writers.</p>
 */
package ca.gc.cra.pacer.domain.quality;
