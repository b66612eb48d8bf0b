package ca.gc.cra.pacer.domain.frame;

import java.util.Objects;

/**
 * Frame handed to the governor by the capture source.
 *
 * @param handle opaque reference to the image data; owned by the capture source, never copied
 * @param timestampNanos monotonic capture timestamp in nanoseconds
 * @param priority priority class used for buffering decisions
 * @param <T> handle type supplied by the capture source
 * @since PACER 0.1
 */
public record CapturedFrame<T>(T handle, long timestampNanos, FramePriority priority) {
  /**
   * Validates the frame components.
   *
   * @throws NullPointerException when {@code handle} or {@code priority} is {@code null}
   */
  public CapturedFrame {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(priority, "priority");
  }
}
