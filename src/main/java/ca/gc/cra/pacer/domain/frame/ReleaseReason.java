package ca.gc.cra.pacer.domain.frame;

/**
 * Why the governor handed a frame back to its capture source.
 *
 * @since PACER 0.1
 */
public enum ReleaseReason {
  /** Admission refused the frame before it was buffered. */
  REJECTED,
  /** The frame store evicted the frame to stay within capacity. */
  EVICTED,
  /** The frame store was cleared by a reset or shutdown. */
  CLEARED,
  /** Analysis finished and the frame is no longer referenced. */
  CONSUMED;

  /**
   * Indicates whether the release counts as a dropped frame.
   *
   * @return {@code true} for frames discarded without analysis
   */
  public boolean isDrop() {
    return this == REJECTED || this == EVICTED;
  }
}
