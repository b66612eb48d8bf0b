package ca.gc.cra.pacer.application.port;

import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;

/**
 * Port notified whenever the governor stops referencing a frame.
 * <p>The capture source releases the underlying image buffer in response. Invoked on whichever thread
 * discarded the frame, so implementations must be thread-safe and fast.</p>
 *
 * @param <T> opaque frame handle type
 * @since 0.1.0
 */
@FunctionalInterface
public interface FrameReleaseListener<T> {
  /**
   * Signals that the governor no longer holds {@code frame}.
   *
   * @param frame released frame
   * @param reason why the frame was released
   */
  void onReleased(CapturedFrame<T> frame, ReleaseReason reason);

  /**
   * Returns a listener that ignores notifications.
   *
   * @param <T> frame handle type
   * @return no-op listener
   */
  static <T> FrameReleaseListener<T> ignoring() {
    return (frame, reason) -> {};
  }
}
