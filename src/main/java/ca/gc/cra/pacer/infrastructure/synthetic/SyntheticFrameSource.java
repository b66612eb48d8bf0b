package ca.gc.cra.pacer.infrastructure.synthetic;

import ca.gc.cra.pacer.application.port.ClockPort;
import ca.gc.cra.pacer.application.port.FrameSource;
import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import ca.gc.cra.pacer.domain.frame.FramePriority;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits 1920x1080 {@link SyntheticFrame}s at a fixed frame rate, paced against the clock.
 * <p>Every {@code highPriorityEvery}-th frame is {@link FramePriority#HIGH}, every {@code lowPriorityEvery}-th
 * remaining frame is {@link FramePriority#LOW}, the rest are {@link FramePriority#NORMAL}. The source is
 * exhausted after {@code frameLimit} frames or once {@code runDuration} has elapsed since {@link #start()};
 * a zero limit or duration disables that bound.</p>
 * <p>Not thread-safe; polled by a single capture thread.</p>
 *
 * @since PACER 0.1
 */
public final class SyntheticFrameSource implements FrameSource<SyntheticFrame> {
  private static final Logger log = LoggerFactory.getLogger(SyntheticFrameSource.class);

  static final int SENSOR_WIDTH = 1920;
  static final int SENSOR_HEIGHT = 1080;

  private final ClockPort clock;
  private final long periodNanos;
  private final long frameLimit;
  private final long runDurationNanos;
  private final int highPriorityEvery;
  private final int lowPriorityEvery;

  private long startNanos;
  private long produced;
  private boolean started;

  /**
   * Creates a source.
   *
   * @param clock pacing clock
   * @param frameRate frames per second; positive
   * @param frameLimit maximum frames, or {@code 0} for no limit
   * @param runDuration maximum run time, or {@link Duration#ZERO} for no limit
   * @param highPriorityEvery period of HIGH frames, or {@code 0} for none
   * @param lowPriorityEvery period of LOW frames, or {@code 0} for none
   */
  public SyntheticFrameSource(
      ClockPort clock,
      double frameRate,
      long frameLimit,
      Duration runDuration,
      int highPriorityEvery,
      int lowPriorityEvery) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (Double.isNaN(frameRate) || frameRate <= 0d) {
      throw new IllegalArgumentException("frameRate must be positive (was " + frameRate + ")");
    }
    if (frameLimit < 0 || highPriorityEvery < 0 || lowPriorityEvery < 0) {
      throw new IllegalArgumentException("frame limit and priority periods must not be negative");
    }
    Objects.requireNonNull(runDuration, "runDuration");
    if (runDuration.isNegative()) {
      throw new IllegalArgumentException("runDuration must not be negative");
    }
    if (frameLimit == 0 && runDuration.isZero()) {
      throw new IllegalArgumentException("either frameLimit or runDuration must bound the source");
    }
    this.periodNanos = Math.max(1L, Math.round(1_000_000_000d / frameRate));
    this.frameLimit = frameLimit;
    this.runDurationNanos = runDuration.toNanos();
    this.highPriorityEvery = highPriorityEvery;
    this.lowPriorityEvery = lowPriorityEvery;
  }

  @Override
  public void start() {
    startNanos = clock.nanoTime();
    produced = 0;
    started = true;
    log.debug("Synthetic source started: period {} ns, limit {}, duration {} ns", periodNanos, frameLimit,
        runDurationNanos);
  }

  @Override
  public Optional<CapturedFrame<SyntheticFrame>> poll() throws InterruptedException {
    if (!started) {
      throw new IllegalStateException("Synthetic source not started");
    }
    if (isExhausted()) {
      return Optional.empty();
    }
    long due = startNanos + produced * periodNanos;
    long wait = due - clock.nanoTime();
    if (wait > 0) {
      TimeUnit.NANOSECONDS.sleep(wait);
    }
    long sequence = produced++;
    long capturedAt = clock.nanoTime();
    SyntheticFrame handle = new SyntheticFrame(sequence, SENSOR_WIDTH, SENSOR_HEIGHT, capturedAt);
    return Optional.of(new CapturedFrame<>(handle, capturedAt, priorityOf(sequence)));
  }

  FramePriority priorityOf(long sequence) {
    if (highPriorityEvery > 0 && sequence % highPriorityEvery == 0) {
      return FramePriority.HIGH;
    }
    if (lowPriorityEvery > 0 && sequence % lowPriorityEvery == 0) {
      return FramePriority.LOW;
    }
    return FramePriority.NORMAL;
  }

  @Override
  public boolean isExhausted() {
    if (!started) {
      return false;
    }
    if (frameLimit > 0 && produced >= frameLimit) {
      return true;
    }
    return runDurationNanos > 0 && clock.nanoTime() - startNanos >= runDurationNanos;
  }

  /**
   * Returns the number of frames produced so far.
   *
   * @return frame count
   */
  public long produced() {
    return produced;
  }

  @Override
  public void close() {
    started = false;
  }
}
