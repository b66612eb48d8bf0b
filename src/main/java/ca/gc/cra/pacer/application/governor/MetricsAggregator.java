package ca.gc.cra.pacer.application.governor;

import ca.gc.cra.pacer.domain.metrics.PerformanceSnapshot;
import ca.gc.cra.pacer.domain.metrics.RollingWindow;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.logging.Logs;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rolling processing-time windows and frame counters behind {@link PerformanceSnapshot}.
 * <p>Windows share one lock that nothing else takes; counters are atomics. The aggregator performs no I/O: memory
 * and throttling state are passed in by the caller when a snapshot is built.</p>
 *
 * @since PACER 0.1
 */
public final class MetricsAggregator {
  private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

  static final int SNAPSHOT_WINDOW = 100;
  static final int LOG_WINDOW = 30;
  static final int LOG_EVERY = 30;
  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private final ReentrantLock windowLock = new ReentrantLock();
  private final RollingWindow snapshotWindow = new RollingWindow(SNAPSHOT_WINDOW);
  private final RollingWindow logWindow = new RollingWindow(LOG_WINDOW);
  private final AtomicLong totalFrames = new AtomicLong();
  private final AtomicLong droppedFrames = new AtomicLong();
  private final AtomicLong completedAnalyses = new AtomicLong();
  private volatile boolean loggingEnabled;

  /**
   * Creates an aggregator.
   *
   * @param loggingEnabled whether to log the rolling average every {@value #LOG_EVERY} completed analyses
   */
  public MetricsAggregator(boolean loggingEnabled) {
    this.loggingEnabled = loggingEnabled;
  }

  /** Counts a frame presented for admission. */
  public void recordFrameSeen() {
    totalFrames.incrementAndGet();
  }

  /** Counts a frame discarded without analysis. */
  public void recordDroppedFrame() {
    droppedFrames.incrementAndGet();
  }

  /**
   * Records a completed analysis.
   *
   * @param durationNanos analysis duration; negative values are clamped to zero
   * @return mean of the most recent {@value ThrottlingGuard#LATENCY_WINDOW} durations, including this one
   */
  public double recordProcessingTime(long durationNanos) {
    long sample = Math.max(0L, durationNanos);
    long completed = completedAnalyses.incrementAndGet();
    double recent;
    double logAverage = 0d;
    boolean logNow = loggingEnabled && completed % LOG_EVERY == 0;
    windowLock.lock();
    try {
      snapshotWindow.add(sample);
      logWindow.add(sample);
      recent = snapshotWindow.averageOfLatest(ThrottlingGuard.LATENCY_WINDOW);
      if (logNow) {
        logAverage = logWindow.average();
      }
    } finally {
      windowLock.unlock();
    }
    if (logNow) {
      log.info("Avg processing time (last {} analyses): {}", LOG_WINDOW, Logs.millis((long) logAverage));
    }
    return recent;
  }

  /**
   * Returns the mean over the snapshot window.
   *
   * @return mean duration in nanoseconds; {@code 0} when no analysis completed
   */
  public double averageProcessingNanos() {
    windowLock.lock();
    try {
      return snapshotWindow.average();
    } finally {
      windowLock.unlock();
    }
  }

  public long totalFrames() {
    return totalFrames.get();
  }

  public long droppedFrames() {
    return droppedFrames.get();
  }

  public long completedAnalyses() {
    return completedAnalyses.get();
  }

  /**
   * Builds a snapshot from the windows, counters, and caller-supplied state.
   *
   * @param targetFrameRate cap for the estimated frame rate
   * @param memoryBytes current memory reading
   * @param level current quality level
   * @param throttling current throttling state
   * @param inFlight current in-flight count
   * @param bufferedFrames current frame store size
   * @return snapshot; zero-valued fields when nothing was recorded
   */
  public PerformanceSnapshot snapshot(
      double targetFrameRate,
      long memoryBytes,
      QualityLevel level,
      boolean throttling,
      int inFlight,
      int bufferedFrames) {
    double averageNanos = averageProcessingNanos();
    double frameRate = averageNanos > 0d ? Math.min(NANOS_PER_SECOND / averageNanos, targetFrameRate) : 0d;
    long total = totalFrames.get();
    long dropped = droppedFrames.get();
    return new PerformanceSnapshot(
        Duration.ofNanos(Math.round(averageNanos)),
        frameRate,
        droppedPercentage(dropped, total),
        memoryBytes,
        level,
        throttling,
        inFlight,
        bufferedFrames,
        total,
        dropped,
        completedAnalyses.get());
  }

  /**
   * Computes {@code dropped / total * 100}.
   *
   * @param dropped dropped frames
   * @param total frames seen
   * @return percentage; {@code 0} when {@code total} is zero
   */
  static double droppedPercentage(long dropped, long total) {
    if (total <= 0) {
      return 0d;
    }
    return (double) dropped / total * 100d;
  }

  /**
   * Clears windows and counters.
   */
  public void reset() {
    windowLock.lock();
    try {
      snapshotWindow.clear();
      logWindow.clear();
    } finally {
      windowLock.unlock();
    }
    totalFrames.set(0);
    droppedFrames.set(0);
    completedAnalyses.set(0);
  }
}
