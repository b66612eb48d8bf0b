package ca.gc.cra.pacer.application.governor;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.pacer.application.governor.AdaptiveQualityController.Decision;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AdaptiveQualityControllerTest {
  private static final Duration BUDGET = Duration.ofMillis(33);
  private static final long BUDGET_NANOS = BUDGET.toNanos();

  @Test
  void durationsAtBudgetNeverTransition() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.HIGH);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, true);

    Map<Decision, Integer> decisions = feed(controller, 30, BUDGET_NANOS, 0);

    assertEquals(30, decisions.getOrDefault(Decision.HOLD, 0));
    assertEquals(QualityLevel.HIGH, quality.current());
  }

  @Test
  void degradesOnceThenRecoversOnce() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.HIGH);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, true);

    Map<Decision, Integer> slow = feed(controller, 30, (long) (BUDGET_NANOS * 1.5), 0);
    assertEquals(1, slow.getOrDefault(Decision.DECREASE, 0));
    assertEquals(0, slow.getOrDefault(Decision.INCREASE, 0));
    assertEquals(QualityLevel.MEDIUM, quality.current());

    Map<Decision, Integer> fast = feed(controller, 30, (long) (BUDGET_NANOS * 0.3), 0);
    assertEquals(1, fast.getOrDefault(Decision.INCREASE, 0));
    assertEquals(0, fast.getOrDefault(Decision.DECREASE, 0));
    assertEquals(QualityLevel.HIGH, quality.current());
  }

  @Test
  void holdsUntilWindowIsFull() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.HIGH);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, true);

    Map<Decision, Integer> decisions = feed(controller, AdaptiveQualityController.WINDOW - 1, BUDGET_NANOS * 3, 0);

    assertEquals(AdaptiveQualityController.WINDOW - 1, decisions.getOrDefault(Decision.HOLD, 0));
    assertEquals(QualityLevel.HIGH, quality.current());
    assertEquals(Decision.DECREASE, controller.onAnalysisCompleted(BUDGET_NANOS * 3, 0));
  }

  @Test
  void busyAnalyzersBlockIncrease() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.HIGH);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, true);

    Map<Decision, Integer> decisions = feed(controller, 30, BUDGET_NANOS / 10, 2);

    assertEquals(0, decisions.getOrDefault(Decision.INCREASE, 0));
    assertEquals(QualityLevel.HIGH, quality.current());
  }

  @Test
  void disabledControllerNeverTransitions() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.HIGH);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, false);

    feed(controller, 90, BUDGET_NANOS * 5, 0);

    assertEquals(QualityLevel.HIGH, quality.current());
  }

  @Test
  void noTransitionReportedAtTheFloor() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.LOW);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, true);

    Map<Decision, Integer> decisions = feed(controller, 30, BUDGET_NANOS * 2, 0);

    assertEquals(0, decisions.getOrDefault(Decision.DECREASE, 0));
    assertEquals(QualityLevel.LOW, quality.current());
  }

  @Test
  void decideHonoursHysteresisBand() {
    assertEquals(Decision.HOLD, AdaptiveQualityController.decide(BUDGET_NANOS * 1.2, BUDGET_NANOS, 0, QualityLevel.HIGH));
    assertEquals(Decision.HOLD, AdaptiveQualityController.decide(BUDGET_NANOS * 0.6, BUDGET_NANOS, 0, QualityLevel.HIGH));
    assertEquals(Decision.DECREASE,
        AdaptiveQualityController.decide(BUDGET_NANOS * 1.21, BUDGET_NANOS, 0, QualityLevel.HIGH));
    assertEquals(Decision.INCREASE,
        AdaptiveQualityController.decide(BUDGET_NANOS * 0.5, BUDGET_NANOS, 1, QualityLevel.HIGH));
    // MEDIUM allows three analyzers, so only zero in flight is below half
    assertEquals(Decision.HOLD, AdaptiveQualityController.decide(BUDGET_NANOS * 0.5, BUDGET_NANOS, 1, QualityLevel.MEDIUM));
  }

  @Test
  void resetDiscardsCollectedSamples() {
    QualityStateMachine quality = new QualityStateMachine(QualityLevel.HIGH);
    AdaptiveQualityController controller = new AdaptiveQualityController(quality, BUDGET, true);
    feed(controller, 29, BUDGET_NANOS * 3, 0);

    controller.reset();

    assertEquals(Decision.HOLD, controller.onAnalysisCompleted(BUDGET_NANOS * 3, 0));
    assertEquals(QualityLevel.HIGH, quality.current());
  }

  private static Map<Decision, Integer> feed(
      AdaptiveQualityController controller, int samples, long durationNanos, int inFlight) {
    Map<Decision, Integer> decisions = new EnumMap<>(Decision.class);
    for (int i = 0; i < samples; i++) {
      decisions.merge(controller.onAnalysisCompleted(durationNanos, inFlight), 1, Integer::sum);
    }
    return decisions;
  }
}
