package ca.gc.cra.pacer.application.port;

import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import java.util.Optional;

/**
 * <strong>What:</strong> Port delivering captured frames to the analysis pipeline.
 * <p><strong>Why:</strong> Decouples the pipeline from the camera framework that produces frames.</p>
 * <p><strong>Role:</strong> Capture-side port; adapters wrap camera callbacks or synthetic generators.</p>
 * <p><strong>Thread-safety:</strong> Polled by a single capture thread; implementations need not be thread-safe.</p>
 * <p><strong>Performance:</strong> {@link #poll()} may block briefly while waiting for the next frame.</p>
 *
 * @param <T> opaque frame handle type
 * @since 0.1.0
 */
public interface FrameSource<T> extends AutoCloseable {
  /**
   * Starts frame delivery.
   *
   * @throws Exception when the source cannot be opened
   */
  void start() throws Exception;

  /**
   * Returns the next frame if one is available.
   *
   * @return next frame, or empty when none arrived within the source's poll timeout
   * @throws Exception when the source fails
   */
  Optional<CapturedFrame<T>> poll() throws Exception;

  /**
   * Indicates whether the source has no more frames to deliver.
   *
   * @return {@code true} for finite sources that reached their end
   */
  default boolean isExhausted() {
    return false;
  }

  @Override
  void close() throws Exception;
}
