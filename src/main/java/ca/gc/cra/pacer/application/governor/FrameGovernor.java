package ca.gc.cra.pacer.application.governor;

import ca.gc.cra.pacer.application.port.ClockPort;
import ca.gc.cra.pacer.application.port.FrameReleaseListener;
import ca.gc.cra.pacer.application.port.MemoryProbePort;
import ca.gc.cra.pacer.application.port.MetricsPort;
import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import ca.gc.cra.pacer.domain.frame.FramePriority;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;
import ca.gc.cra.pacer.domain.metrics.PerformanceSnapshot;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import ca.gc.cra.pacer.infrastructure.buffer.PriorityFrameStore;
import ca.gc.cra.pacer.infrastructure.buffer.PriorityFrameStore.StoredFrame;
import ca.gc.cra.pacer.logging.Logs;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Real-time frame admission and adaptive-quality governor.
 * <p>Facade over the admission controller, quality state machine, adaptive controller, throttling guard, metrics
 * aggregator, and priority frame store. Instances are constructed explicitly and handed to the capture pipeline;
 * there is no process-wide instance.</p>
 * <p>A frame counts as dropped when the governor discards a frame it was handed: a store eviction, or a rejection
 * inside {@link #offerFrame(Object, long, FramePriority)}. {@link #shouldAdmit(long)} never counts drops; hosts
 * that call it directly report drops with {@link #recordDroppedFrame()}.</p>
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use by the camera thread and analyzer
 * workers.</p>
 *
 * @param <T> opaque frame handle type
 * @since PACER 0.1
 */
public final class FrameGovernor<T> {
  private static final Logger log = LoggerFactory.getLogger(FrameGovernor.class);

  private final ClockPort clock;
  private final MetricsPort metrics;
  private final FrameReleaseListener<T> releaseListener;
  private final QualityStateMachine quality;
  private final PriorityFrameStore<T> store;
  private final ThrottlingGuard throttlingGuard;
  private final AdmissionController admission;
  private final AdaptiveQualityController adaptive;
  private final MetricsAggregator aggregator;

  private volatile GovernorSettings settings;

  /**
   * Creates a governor.
   *
   * @param settings initial settings
   * @param clock monotonic clock
   * @param memoryProbe resident memory probe
   * @param metrics metrics sink
   * @param releaseListener notified whenever the governor discards a frame
   */
  public FrameGovernor(
      GovernorSettings settings,
      ClockPort clock,
      MemoryProbePort memoryProbe,
      MetricsPort metrics,
      FrameReleaseListener<T> releaseListener) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.releaseListener = Objects.requireNonNull(releaseListener, "releaseListener");
    this.quality = new QualityStateMachine(settings.initialQuality());
    this.store = new PriorityFrameStore<>(settings.capacity());
    this.throttlingGuard = new ThrottlingGuard(
        Objects.requireNonNull(memoryProbe, "memoryProbe"),
        settings.targetBudget(),
        settings.maxMemoryBytes(),
        settings.resourceThrottling(),
        settings.memorySampleInterval());
    this.admission = new AdmissionController(quality, throttlingGuard);
    this.adaptive = new AdaptiveQualityController(quality, settings.targetBudget(), settings.adaptiveQuality());
    this.aggregator = new MetricsAggregator(settings.performanceLogging());
  }

  /**
   * Updates runtime targets. Shrinking the capacity evicts buffered frames.
   *
   * @param targetFrameRate frame rate cap for the estimated rate
   * @param targetBudget per-analysis budget
   * @param maxMemoryBytes resident memory ceiling
   * @param capacity frame store capacity
   * @throws IllegalArgumentException when a value is out of range; the governor is left unchanged
   */
  public void configure(double targetFrameRate, Duration targetBudget, long maxMemoryBytes, int capacity) {
    GovernorSettings updated = settings.withTargets(targetFrameRate, targetBudget, maxMemoryBytes, capacity);
    throttlingGuard.configure(updated.targetBudget(), updated.maxMemoryBytes());
    adaptive.configure(updated.targetBudget());
    settings = updated;
    List<StoredFrame<T>> evicted = store.resize(updated.capacity());
    evicted.forEach(entry -> discard(entry, ReleaseReason.EVICTED));
    log.info(
        "Governor configured - target fps {}, budget {}, memory ceiling {}, capacity {}",
        updated.targetFrameRate(),
        Logs.millis(updated.targetBudget().toNanos()),
        Logs.mebibytes(updated.maxMemoryBytes()),
        updated.capacity());
  }

  public GovernorSettings settings() {
    return settings;
  }

  /**
   * Manually overrides the quality level. A change restarts the adaptive window so that durations measured at
   * the previous level cannot undo the override.
   *
   * @param level new level
   */
  public void setQualityLevel(QualityLevel level) {
    QualityLevel previous = quality.set(level);
    if (previous != level) {
      adaptive.reset();
    }
    log.info("Quality level set to {} (was {})", level, previous);
  }

  public QualityLevel qualityLevel() {
    return quality.current();
  }

  /**
   * Admission check using the governor clock.
   *
   * @return {@code true} when admitted
   * @see #shouldAdmit(long)
   */
  public boolean shouldAdmit() {
    return shouldAdmit(clock.nanoTime());
  }

  /**
   * Decides whether a frame arriving at {@code nowNanos} is analyzed. Counts the frame as seen; an admitted frame
   * is immediately counted as in flight until {@link #endAnalysis(Duration)}. Reads the memory probe when the
   * cached reading is older than {@link GovernorSettings#memorySampleInterval()}.
   *
   * @param nowNanos monotonic timestamp
   * @return {@code true} when admitted
   */
  public boolean shouldAdmit(long nowNanos) {
    return evaluateAdmission(nowNanos).admitted();
  }

  /**
   * Same as {@link #shouldAdmit(long)} but reports the reason for a rejection.
   *
   * @param nowNanos monotonic timestamp
   * @return admission decision
   */
  public AdmissionDecision evaluateAdmission(long nowNanos) {
    aggregator.recordFrameSeen();
    metrics.increment("governor.frame.seen");
    throttlingGuard.sampleMemoryIfDue(nowNanos);
    AdmissionDecision decision = admission.evaluate(nowNanos);
    if (!decision.admitted()) {
      metrics.increment(decision.rejectionMetricKey());
    }
    return decision;
  }

  /**
   * Records an admission decided by the host, bypassing the checks.
   */
  public void beginAdmission() {
    beginAdmission(clock.nanoTime());
  }

  /**
   * Records an admission decided by the host at {@code nowNanos}, bypassing the checks.
   *
   * @param nowNanos monotonic timestamp
   */
  public void beginAdmission(long nowNanos) {
    admission.beginAdmission(nowNanos);
  }

  /**
   * Completes one analysis: releases its in-flight slot and feeds the duration to metrics, throttling, and
   * adaptive quality.
   *
   * @param duration analysis duration; must not be {@code null}
   */
  public void endAnalysis(Duration duration) {
    long nanos = Math.max(0L, Objects.requireNonNull(duration, "duration").toNanos());
    int remaining = admission.completeAnalysis();
    double recent = aggregator.recordProcessingTime(nanos);
    throttlingGuard.recordRecentLatency(recent);
    metrics.observe("governor.analysis.durationNanos", nanos);
    AdaptiveQualityController.Decision decision = adaptive.onAnalysisCompleted(nanos, remaining);
    if (decision == AdaptiveQualityController.Decision.DECREASE) {
      metrics.increment("governor.quality.decrease");
    } else if (decision == AdaptiveQualityController.Decision.INCREASE) {
      metrics.increment("governor.quality.increase");
    }
  }

  /**
   * Counts a frame the host discarded after a rejection.
   */
  public void recordDroppedFrame() {
    aggregator.recordDroppedFrame();
    metrics.increment("governor.frame.dropped");
  }

  /**
   * Buffers a frame without an admission check. The frame counts as seen, and an eviction caused by the insert
   * counts as a drop. Use {@link #offerFrame(Object, long, FramePriority)} to admit and buffer in one call.
   *
   * @param handle frame handle
   * @param timestampNanos capture timestamp
   * @param priority priority class
   * @return {@code true} when the frame stayed buffered; {@code false} when it was itself evicted
   */
  public boolean addFrame(T handle, long timestampNanos, FramePriority priority) {
    aggregator.recordFrameSeen();
    metrics.increment("governor.frame.seen");
    return buffer(new CapturedFrame<>(handle, timestampNanos, priority), false);
  }

  /**
   * Runs admission for a frame and buffers it when admitted. Rejected frames are counted as dropped and released.
   *
   * @param handle frame handle
   * @param timestampNanos capture timestamp
   * @param priority priority class
   * @return admission decision
   */
  public AdmissionDecision offerFrame(T handle, long timestampNanos, FramePriority priority) {
    CapturedFrame<T> frame = new CapturedFrame<>(handle, timestampNanos, priority);
    AdmissionDecision decision = evaluateAdmission(clock.nanoTime());
    if (!decision.admitted()) {
      recordDroppedFrame();
      notifyReleased(frame, ReleaseReason.REJECTED);
      return decision;
    }
    buffer(frame, true);
    return decision;
  }

  /**
   * Removes the highest priority, most recent buffered frame. The caller owns the frame from here on and must
   * call {@link #endAnalysis(Duration)} once it is analyzed.
   *
   * @return next frame, or empty when nothing is buffered
   */
  public Optional<CapturedFrame<T>> takeNextFrame() {
    return store.takeNext().map(StoredFrame::frame);
  }

  /**
   * Returns the number of buffered frames.
   *
   * @return store size
   */
  public int bufferedFrames() {
    return store.size();
  }

  /**
   * Refreshes the cached memory reading used by throttling.
   *
   * @return resident bytes; {@code 0} when the probe failed
   */
  public long refreshMemory() {
    return throttlingGuard.refreshMemory();
  }

  /**
   * Builds a point-in-time performance snapshot. Reads the memory probe, so keep it off the camera thread.
   *
   * @return snapshot
   */
  public PerformanceSnapshot snapshot() {
    long memory = throttlingGuard.refreshMemory();
    boolean throttling = throttlingGuard.isThrottling();
    return aggregator.snapshot(
        settings.targetFrameRate(),
        memory,
        quality.current(),
        throttling,
        admission.inFlight(),
        store.size());
  }

  /**
   * Clears counters, windows, admission state, and buffered frames. The quality level is kept.
   */
  public void reset() {
    List<StoredFrame<T>> drained = store.clear();
    drained.forEach(entry -> notifyReleased(entry.frame(), ReleaseReason.CLEARED));
    aggregator.reset();
    adaptive.reset();
    throttlingGuard.reset();
    admission.reset();
    log.info("Governor metrics reset; {} buffered frames released, quality stays {}", drained.size(), quality.current());
  }

  private boolean buffer(CapturedFrame<T> frame, boolean admitted) {
    Optional<StoredFrame<T>> evicted = store.add(frame, admitted);
    if (evicted.isEmpty()) {
      return true;
    }
    StoredFrame<T> victim = evicted.get();
    discard(victim, ReleaseReason.EVICTED);
    return victim.frame() != frame;
  }

  private void discard(StoredFrame<T> entry, ReleaseReason reason) {
    if (entry.admitted()) {
      admission.completeAnalysis();
    }
    if (reason.isDrop()) {
      metrics.increment("governor.frame.evicted");
      recordDroppedFrame();
    }
    notifyReleased(entry.frame(), reason);
  }

  private void notifyReleased(CapturedFrame<T> frame, ReleaseReason reason) {
    try {
      releaseListener.onReleased(frame, reason);
    } catch (RuntimeException ex) {
      log.warn("Frame release listener failed for {} frame at {}", reason, frame.timestampNanos(), ex);
    }
  }
}
