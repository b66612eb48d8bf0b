package ca.gc.cra.pacer.application.governor;

import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gatekeeper invoked once per arriving frame.
 * <p>Checks run in a fixed order: minimum interval since the last admission, the concurrency cap of the current
 * quality level, then the throttling guard. A passing check commits the admission (timestamp and in-flight
 * increment) under the same lock, so two concurrent callers can never both take the last slot.</p>
 * <p>The controller never counts rejections as drops; callers decide what a rejection means.</p>
 *
 * @since PACER 0.1
 */
public final class AdmissionController {
  private final QualityStateMachine quality;
  private final ThrottlingGuard throttlingGuard;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicInteger inFlight = new AtomicInteger();

  private long lastAdmittedNanos;
  private boolean hasAdmitted;

  /**
   * Creates an admission controller.
   *
   * @param quality source of the current quality level
   * @param throttlingGuard emergency brake consulted after the cheaper checks
   */
  public AdmissionController(QualityStateMachine quality, ThrottlingGuard throttlingGuard) {
    this.quality = Objects.requireNonNull(quality, "quality");
    this.throttlingGuard = Objects.requireNonNull(throttlingGuard, "throttlingGuard");
  }

  /**
   * Decides whether a frame arriving at {@code nowNanos} is admitted, committing the admission when it is.
   *
   * @param nowNanos monotonic timestamp of the decision
   * @return {@code true} when admitted
   */
  public boolean shouldAdmit(long nowNanos) {
    return evaluate(nowNanos).admitted();
  }

  /**
   * Same as {@link #shouldAdmit(long)} but reports why a frame was rejected.
   *
   * @param nowNanos monotonic timestamp of the decision
   * @return decision; {@link AdmissionDecision#ADMITTED} means the admission is already recorded
   */
  public AdmissionDecision evaluate(long nowNanos) {
    QualityLevel level = quality.current();
    lock.lock();
    try {
      if (hasAdmitted && nowNanos - lastAdmittedNanos < level.minAnalysisInterval().toNanos()) {
        return AdmissionDecision.TOO_SOON;
      }
      if (inFlight.get() >= level.maxConcurrentAnalyzers()) {
        return AdmissionDecision.AT_CAPACITY;
      }
      if (throttlingGuard.isThrottling()) {
        return AdmissionDecision.THROTTLED;
      }
      recordAdmission(nowNanos);
      return AdmissionDecision.ADMITTED;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records an admission decided outside {@link #evaluate(long)}, for example a frame the host forces through.
   *
   * @param nowNanos monotonic timestamp of the admission
   */
  public void beginAdmission(long nowNanos) {
    lock.lock();
    try {
      recordAdmission(nowNanos);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases one in-flight slot. Unmatched calls leave the count at zero.
   *
   * @return in-flight count after the release
   */
  public int completeAnalysis() {
    return inFlight.updateAndGet(current -> Math.max(0, current - 1));
  }

  /**
   * Returns the number of admitted analyses not yet completed.
   *
   * @return in-flight count; never negative
   */
  public int inFlight() {
    return inFlight.get();
  }

  /**
   * Forgets the last admission and zeroes the in-flight count.
   */
  public void reset() {
    lock.lock();
    try {
      hasAdmitted = false;
      lastAdmittedNanos = 0L;
      inFlight.set(0);
    } finally {
      lock.unlock();
    }
  }

  private void recordAdmission(long nowNanos) {
    lastAdmittedNanos = nowNanos;
    hasAdmitted = true;
    inFlight.incrementAndGet();
  }
}
