package ca.gc.cra.pacer.application.governor;

import ca.gc.cra.pacer.domain.metrics.RollingWindow;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import ca.gc.cra.pacer.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feedback loop that trims the quality level from completed analysis durations.
 * <p>The mean of the last {@value #WINDOW} durations is compared against the budget: above 1.2x the level drops
 * one step, below 0.6x (with fewer than half the level's analyzers busy) it rises one step, anything in between
 * holds. A decision is only taken on a full window, and the window restarts after each transition so the next
 * decision only sees durations measured at the new level.</p>
 *
 * @since PACER 0.1
 */
public final class AdaptiveQualityController {
  private static final Logger log = LoggerFactory.getLogger(AdaptiveQualityController.class);

  /** Number of durations averaged per decision. */
  public static final int WINDOW = 30;
  static final double DECREASE_FACTOR = 1.2d;
  static final double INCREASE_FACTOR = 0.6d;

  private final QualityStateMachine quality;
  private final RollingWindow window = new RollingWindow(WINDOW);
  private final ReentrantLock lock = new ReentrantLock();

  private volatile long budgetNanos;
  private volatile boolean enabled;

  /**
   * Creates a controller.
   *
   * @param quality state machine to drive
   * @param budget per-analysis budget
   * @param enabled whether completed analyses may change the level
   */
  public AdaptiveQualityController(QualityStateMachine quality, Duration budget, boolean enabled) {
    this.quality = Objects.requireNonNull(quality, "quality");
    this.enabled = enabled;
    configure(budget);
  }

  /**
   * Updates the budget.
   *
   * @param budget per-analysis budget; must be positive
   */
  public void configure(Duration budget) {
    Objects.requireNonNull(budget, "budget");
    if (budget.isNegative() || budget.isZero()) {
      throw new IllegalArgumentException("budget must be positive");
    }
    this.budgetNanos = budget.toNanos();
  }

  /**
   * Records a completed analysis and applies at most one quality transition.
   *
   * @param durationNanos analysis duration
   * @param inFlight analyses still in flight after this completion
   * @return transition applied; {@link Decision#HOLD} when the level did not change
   */
  public Decision onAnalysisCompleted(long durationNanos, int inFlight) {
    if (!enabled) {
      return Decision.HOLD;
    }
    double average;
    Decision applied;
    QualityLevel before;
    QualityLevel after;
    lock.lock();
    try {
      window.add(Math.max(0L, durationNanos));
      if (!window.isFull()) {
        return Decision.HOLD;
      }
      average = window.average();
      before = quality.current();
      Decision wanted = decide(average, budgetNanos, inFlight, before);
      applied = apply(wanted);
      if (applied == Decision.HOLD) {
        return Decision.HOLD;
      }
      window.clear();
      after = quality.current();
    } finally {
      lock.unlock();
    }
    log.info("Quality {} from {} to {} (avg processing time {})",
        applied == Decision.DECREASE ? "decreased" : "increased",
        before,
        after,
        Logs.millis((long) average));
    return applied;
  }

  /**
   * Pure decision function used by {@link #onAnalysisCompleted(long, int)}.
   *
   * @param averageNanos mean duration of the window
   * @param budgetNanos per-analysis budget
   * @param inFlight analyses in flight
   * @param level current quality level
   * @return requested transition
   */
  static Decision decide(double averageNanos, long budgetNanos, int inFlight, QualityLevel level) {
    if (averageNanos > budgetNanos * DECREASE_FACTOR) {
      return Decision.DECREASE;
    }
    if (averageNanos < budgetNanos * INCREASE_FACTOR && inFlight < level.maxConcurrentAnalyzers() / 2) {
      return Decision.INCREASE;
    }
    return Decision.HOLD;
  }

  /**
   * Discards buffered durations.
   */
  public void reset() {
    lock.lock();
    try {
      window.clear();
    } finally {
      lock.unlock();
    }
  }

  private Decision apply(Decision wanted) {
    return switch (wanted) {
      case DECREASE -> quality.decrease() ? Decision.DECREASE : Decision.HOLD;
      case INCREASE -> quality.increase() ? Decision.INCREASE : Decision.HOLD;
      case HOLD -> Decision.HOLD;
    };
  }

  /** Quality transition requested or applied by the controller. */
  public enum Decision {
    HOLD,
    INCREASE,
    DECREASE
  }
}
