/**
 * <strong>Purpose:</strong> Validation helpers for CLI and configuration inputs.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 * <p><strong>Observability:</strong> Violations raise {@link java.lang.IllegalArgumentException} naming the key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.validation;
