package ca.gc.cra.pacer.application.pipeline;

import ca.gc.cra.pacer.application.port.FrameReleaseListener;
import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Release listener that counts frames per {@link ReleaseReason} and optionally forwards to a delegate.
 *
 * @param <T> frame handle type
 * @since PACER 0.1
 */
public final class ReleaseTally<T> implements FrameReleaseListener<T> {
  private final Map<ReleaseReason, LongAdder> counts = new EnumMap<>(ReleaseReason.class);
  private final FrameReleaseListener<T> delegate;

  public ReleaseTally() {
    this(FrameReleaseListener.ignoring());
  }

  /**
   * Creates a tally that forwards every release to {@code delegate}, for example to return a camera buffer.
   *
   * @param delegate downstream listener
   */
  public ReleaseTally(FrameReleaseListener<T> delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    for (ReleaseReason reason : ReleaseReason.values()) {
      counts.put(reason, new LongAdder());
    }
  }

  @Override
  public void onReleased(CapturedFrame<T> frame, ReleaseReason reason) {
    counts.get(reason).increment();
    delegate.onReleased(frame, reason);
  }

  /**
   * Returns the number of frames released for {@code reason}.
   *
   * @param reason release reason
   * @return count
   */
  public long count(ReleaseReason reason) {
    return counts.get(Objects.requireNonNull(reason, "reason")).sum();
  }

  /**
   * Returns the number of releases that count as drops.
   *
   * @return rejected plus evicted frames
   */
  public long dropped() {
    long total = 0;
    for (ReleaseReason reason : ReleaseReason.values()) {
      if (reason.isDrop()) {
        total += count(reason);
      }
    }
    return total;
  }

  /**
   * Returns the number of releases for any reason.
   *
   * @return total releases
   */
  public long total() {
    long total = 0;
    for (LongAdder adder : counts.values()) {
      total += adder.sum();
    }
    return total;
  }
}
