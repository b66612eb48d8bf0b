package ca.gc.cra.pacer.domain.quality;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link QualityLevel} and moves it one step at a time.
 * <p>Transitions are compare-and-set updates so concurrent callers never skip a level.</p>
 *
 * @since PACER 0.1
 */
public final class QualityStateMachine {
  /** Level used when nothing else is configured. */
  public static final QualityLevel INITIAL_LEVEL = QualityLevel.HIGH;

  private final AtomicReference<QualityLevel> current;

  /**
   * Creates a state machine starting at {@link #INITIAL_LEVEL}.
   */
  public QualityStateMachine() {
    this(INITIAL_LEVEL);
  }

  /**
   * Creates a state machine starting at the given level.
   *
   * @param initial starting level; must not be {@code null}
   */
  public QualityStateMachine(QualityLevel initial) {
    this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
  }

  /**
   * Returns the current level.
   *
   * @return current level; never {@code null}
   */
  public QualityLevel current() {
    return current.get();
  }

  /**
   * Moves one level up.
   *
   * @return {@code true} when the level changed; {@code false} at {@link QualityLevel#ULTRA}
   */
  public boolean increase() {
    return step(true);
  }

  /**
   * Moves one level down.
   *
   * @return {@code true} when the level changed; {@code false} at {@link QualityLevel#LOW}
   */
  public boolean decrease() {
    return step(false);
  }

  /**
   * Overrides the current level.
   *
   * @param level new level; must not be {@code null}
   * @return level replaced by the override
   */
  public QualityLevel set(QualityLevel level) {
    return current.getAndSet(Objects.requireNonNull(level, "level"));
  }

  private boolean step(boolean up) {
    while (true) {
      QualityLevel before = current.get();
      QualityLevel after = up ? before.higher() : before.lower();
      if (after == before) {
        return false;
      }
      if (current.compareAndSet(before, after)) {
        return true;
      }
    }
  }
}
