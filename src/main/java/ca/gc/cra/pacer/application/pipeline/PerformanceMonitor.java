package ca.gc.cra.pacer.application.pipeline;

import ca.gc.cra.pacer.application.governor.FrameGovernor;
import ca.gc.cra.pacer.application.port.MetricsPort;
import ca.gc.cra.pacer.domain.metrics.PerformanceSnapshot;
import ca.gc.cra.pacer.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.pacer.logging.Logs;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically samples resident memory for the throttling guard and reports governor snapshots.
 * <p>Two schedules share one daemon thread: a memory refresh every {@code memorySampleInterval} and a snapshot
 * report every {@code monitorInterval}. A report warns when more than 10 % of frames were dropped or memory is
 * above 80 % of the ceiling.</p>
 * <p><strong>Thread-safety:</strong> {@link #start()} and {@link #close()} may be called from any thread;
 * {@link #report()} is safe to call concurrently with the schedule.</p>
 *
 * @since PACER 0.1
 */
public final class PerformanceMonitor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

  static final double DROPPED_WARNING_PERCENT = 10d;
  static final double MEMORY_WARNING_RATIO = 0.8d;

  private final FrameGovernor<?> governor;
  private final MetricsPort metrics;
  private final Duration reportInterval;
  private final Duration memorySampleInterval;

  private ScheduledExecutorService scheduler;

  /**
   * Creates a monitor.
   *
   * @param governor governor to sample
   * @param metrics metrics sink for {@code monitor.*} observations
   * @param reportInterval snapshot period
   * @param memorySampleInterval memory refresh period
   */
  public PerformanceMonitor(
      FrameGovernor<?> governor, MetricsPort metrics, Duration reportInterval, Duration memorySampleInterval) {
    this.governor = Objects.requireNonNull(governor, "governor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.reportInterval = Objects.requireNonNull(reportInterval, "reportInterval");
    this.memorySampleInterval = Objects.requireNonNull(memorySampleInterval, "memorySampleInterval");
  }

  /**
   * Starts both schedules. The first memory sample is taken immediately.
   *
   * @throws IllegalStateException when already started
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Performance monitor already started");
    }
    scheduler = ExecutorFactories.newMonitorScheduler("pacer-monitor");
    scheduler.scheduleAtFixedRate(
        this::sampleMemory, 0L, memorySampleInterval.toMillis(), TimeUnit.MILLISECONDS);
    scheduler.scheduleAtFixedRate(
        this::reportSafely, reportInterval.toMillis(), reportInterval.toMillis(), TimeUnit.MILLISECONDS);
    log.debug(
        "Performance monitor started (report every {} ms, memory every {} ms)",
        reportInterval.toMillis(),
        memorySampleInterval.toMillis());
  }

  /**
   * Builds a snapshot, publishes it as metrics, and logs warnings when thresholds are crossed.
   *
   * @return the snapshot that was reported
   */
  public PerformanceSnapshot report() {
    PerformanceSnapshot snapshot = governor.snapshot();
    metrics.observe("monitor.memory.bytes", snapshot.memoryUsageBytes());
    metrics.observe("monitor.dropped.percent", Math.round(snapshot.droppedFramePercentage()));
    if (governor.settings().performanceLogging()) {
      log.info(
          "Performance: avg {} | fps {} | dropped {} | memory {} | quality {} | in flight {}",
          Logs.millis(snapshot.averageProcessingTime().toNanos()),
          String.format(Locale.ROOT, "%.1f", snapshot.estimatedFrameRate()),
          Logs.percent(snapshot.droppedFramePercentage()),
          Logs.mebibytes(snapshot.memoryUsageBytes()),
          snapshot.qualityLevel(),
          snapshot.inFlight());
    }
    if (highDropRate(snapshot)) {
      log.warn("High frame drop rate: {}", Logs.percent(snapshot.droppedFramePercentage()));
    }
    long ceiling = governor.settings().maxMemoryBytes();
    if (memoryPressure(snapshot, ceiling)) {
      log.warn(
          "High memory usage: {} of {} ceiling",
          Logs.mebibytes(snapshot.memoryUsageBytes()),
          Logs.mebibytes(ceiling));
    }
    return snapshot;
  }

  static boolean highDropRate(PerformanceSnapshot snapshot) {
    return snapshot.droppedFramePercentage() > DROPPED_WARNING_PERCENT;
  }

  static boolean memoryPressure(PerformanceSnapshot snapshot, long maxMemoryBytes) {
    return snapshot.memoryUsageBytes() > maxMemoryBytes * MEMORY_WARNING_RATIO;
  }

  private void sampleMemory() {
    try {
      governor.refreshMemory();
    } catch (RuntimeException ex) {
      log.warn("Memory sample failed", ex);
    }
  }

  private void reportSafely() {
    try {
      report();
    } catch (RuntimeException ex) {
      log.warn("Performance report failed", ex);
    }
  }

  /**
   * Stops both schedules. Idempotent.
   */
  @Override
  public synchronized void close() {
    ScheduledExecutorService current = scheduler;
    if (current == null) {
      return;
    }
    scheduler = null;
    current.shutdownNow();
    try {
      if (!current.awaitTermination(1, TimeUnit.SECONDS)) {
        log.warn("Performance monitor did not stop within 1 s");
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }
}
