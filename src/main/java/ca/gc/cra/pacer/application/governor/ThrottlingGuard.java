package ca.gc.cra.pacer.application.governor;

import ca.gc.cra.pacer.application.port.MemoryProbePort;
import ca.gc.cra.pacer.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emergency brake that forces admission rejection under resource pressure.
 * <p>Trips when resident memory exceeds the ceiling or when the mean of the last 10 analysis durations exceeds
 * 1.5x the budget. Both inputs are cached: the latency mean is pushed after every completed analysis and the
 * memory reading is refreshed by {@link #sampleMemoryIfDue(long)} once per sample interval, or by a background
 * monitor through {@link #refreshMemory()}. {@link #isThrottling()} itself is a handful of volatile reads.</p>
 *
 * @since PACER 0.1
 */
public final class ThrottlingGuard {
  private static final Logger log = LoggerFactory.getLogger(ThrottlingGuard.class);

  /** Number of recent durations averaged for the latency check. */
  public static final int LATENCY_WINDOW = 10;
  static final double LATENCY_FACTOR = 1.5d;
  private static final long NOT_SAMPLED = Long.MIN_VALUE;

  private final MemoryProbePort memoryProbe;
  private final AtomicReference<Reason> lastReason = new AtomicReference<>(Reason.NONE);
  private final AtomicLong nextSampleNanos = new AtomicLong(NOT_SAMPLED);
  private final long sampleIntervalNanos;

  private volatile boolean enabled;
  private volatile long budgetNanos;
  private volatile long maxMemoryBytes;
  private volatile long memoryBytes;
  private volatile double recentLatencyNanos;

  /**
   * Creates a guard.
   *
   * @param memoryProbe platform memory probe
   * @param budget per-analysis budget
   * @param maxMemoryBytes resident memory ceiling
   * @param enabled whether the guard may report throttling at all
   */
  public ThrottlingGuard(MemoryProbePort memoryProbe, Duration budget, long maxMemoryBytes, boolean enabled) {
    this(memoryProbe, budget, maxMemoryBytes, enabled, GovernorSettings.DEFAULT_MEMORY_SAMPLE_INTERVAL);
  }

  /**
   * Creates a guard with an explicit memory sample interval.
   *
   * @param memoryProbe platform memory probe
   * @param budget per-analysis budget
   * @param maxMemoryBytes resident memory ceiling
   * @param enabled whether the guard may report throttling at all
   * @param memorySampleInterval maximum age of the memory reading before {@link #sampleMemoryIfDue(long)} reads
   *     the probe again; positive
   */
  public ThrottlingGuard(
      MemoryProbePort memoryProbe,
      Duration budget,
      long maxMemoryBytes,
      boolean enabled,
      Duration memorySampleInterval) {
    this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
    Objects.requireNonNull(memorySampleInterval, "memorySampleInterval");
    if (memorySampleInterval.isNegative() || memorySampleInterval.isZero()) {
      throw new IllegalArgumentException("memorySampleInterval must be positive");
    }
    this.sampleIntervalNanos = memorySampleInterval.toNanos();
    this.enabled = enabled;
    configure(budget, maxMemoryBytes);
  }

  /**
   * Updates the thresholds.
   *
   * @param budget per-analysis budget; must be positive
   * @param ceilingBytes resident memory ceiling; must be positive
   */
  public void configure(Duration budget, long ceilingBytes) {
    Objects.requireNonNull(budget, "budget");
    if (budget.isNegative() || budget.isZero()) {
      throw new IllegalArgumentException("budget must be positive");
    }
    if (ceilingBytes <= 0) {
      throw new IllegalArgumentException("maxMemoryBytes must be positive");
    }
    this.budgetNanos = budget.toNanos();
    this.maxMemoryBytes = ceilingBytes;
  }

  /**
   * Reads the memory probe and caches the value for subsequent checks.
   *
   * @return resident bytes; {@code 0} when the probe failed
   */
  public long refreshMemory() {
    long reading = Math.max(0L, memoryProbe.residentMemoryBytes());
    memoryBytes = reading;
    return reading;
  }

  /**
   * Reads the memory probe when no reading was taken yet or the last one is older than the sample interval.
   * Concurrent callers race for the sample; only the winner reads the probe.
   *
   * @param nowNanos monotonic timestamp
   * @return {@code true} when the probe was read
   */
  public boolean sampleMemoryIfDue(long nowNanos) {
    if (!enabled) {
      return false;
    }
    long due = nextSampleNanos.get();
    if (due != NOT_SAMPLED && nowNanos - due < 0) {
      return false;
    }
    if (!nextSampleNanos.compareAndSet(due, nowNanos + sampleIntervalNanos)) {
      return false;
    }
    refreshMemory();
    return true;
  }

  /**
   * Caches the mean of the most recent {@value #LATENCY_WINDOW} analysis durations.
   *
   * @param averageNanos recent mean in nanoseconds
   */
  public void recordRecentLatency(double averageNanos) {
    recentLatencyNanos = Math.max(0d, averageNanos);
  }

  /**
   * Indicates whether admission must currently be refused.
   *
   * @return {@code true} when memory or recent latency exceeds its ceiling and the guard is enabled
   */
  public boolean isThrottling() {
    Reason reason = enabled ? currentReason() : Reason.NONE;
    Reason previous = lastReason.getAndSet(reason);
    if (previous != reason) {
      logTransition(reason);
    }
    return reason != Reason.NONE;
  }

  /**
   * Returns the last cached memory reading.
   *
   * @return resident bytes
   */
  public long memoryBytes() {
    return memoryBytes;
  }

  public long maxMemoryBytes() {
    return maxMemoryBytes;
  }

  /**
   * Forgets the cached latency; the memory reading is a measurement and is kept.
   */
  public void reset() {
    recentLatencyNanos = 0d;
  }

  private Reason currentReason() {
    if (memoryBytes > maxMemoryBytes) {
      return Reason.MEMORY;
    }
    if (recentLatencyNanos > budgetNanos * LATENCY_FACTOR) {
      return Reason.LATENCY;
    }
    return Reason.NONE;
  }

  private void logTransition(Reason reason) {
    switch (reason) {
      case MEMORY -> log.warn(
          "Throttling admission: memory usage {} exceeds ceiling {}",
          Logs.mebibytes(memoryBytes),
          Logs.mebibytes(maxMemoryBytes));
      case LATENCY -> log.warn(
          "Throttling admission: recent processing time {} exceeds {}",
          Logs.millis((long) recentLatencyNanos),
          Logs.millis((long) (budgetNanos * LATENCY_FACTOR)));
      default -> log.info("Throttling cleared");
    }
  }

  private enum Reason {
    NONE,
    MEMORY,
    LATENCY
  }
}
