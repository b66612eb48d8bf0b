/**
 * <strong>Purpose:</strong> Domain model for frame admission: frame metadata, quality levels, and rolling metrics.
 * <p><strong>Pipeline role:</strong> Domain layer; free of framework dependencies and shared by governor and adapters.
 * <p><strong>Concurrency:</strong> Value types are immutable; mutable helpers document their locking contract.
 * <p><strong>Performance:</strong> Allocation-free on the per-frame path apart from frame records.
 * <p><strong>Observability:</strong> Types expose values consumed by metrics and log lines.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pacer.domain;
