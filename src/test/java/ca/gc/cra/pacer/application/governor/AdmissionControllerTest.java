package ca.gc.cra.pacer.application.governor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.QualityStateMachine;
import ca.gc.cra.pacer.testing.FixedMemoryProbe;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AdmissionControllerTest {
  private static final long MS = 1_000_000L;

  private final FixedMemoryProbe memory = new FixedMemoryProbe(FixedMemoryProbe.mebibytes(50));

  @Test
  void rejectsFramesInsideMinimumInterval() {
    AdmissionController controller = controller(QualityLevel.HIGH, true);

    assertTrue(controller.shouldAdmit(0));
    assertFalse(controller.shouldAdmit(10 * MS));
    assertEquals(AdmissionDecision.TOO_SOON, controller.evaluate(49 * MS));
  }

  @Test
  void admitsOnceIntervalElapsed() {
    AdmissionController controller = controller(QualityLevel.HIGH, true);

    assertTrue(controller.shouldAdmit(0));
    assertTrue(controller.shouldAdmit(60 * MS));
    assertEquals(2, controller.inFlight());
  }

  @Test
  void rejectionDoesNotMoveTheIntervalAnchor() {
    AdmissionController controller = controller(QualityLevel.HIGH, true);

    assertTrue(controller.shouldAdmit(0));
    assertFalse(controller.shouldAdmit(40 * MS));
    assertTrue(controller.shouldAdmit(50 * MS));
  }

  @Test
  void enforcesConcurrencyCapOfCurrentLevel() {
    AdmissionController controller = controller(QualityLevel.LOW, true);

    assertTrue(controller.shouldAdmit(0));
    assertTrue(controller.shouldAdmit(100 * MS));
    assertEquals(AdmissionDecision.AT_CAPACITY, controller.evaluate(200 * MS));

    controller.completeAnalysis();
    assertTrue(controller.shouldAdmit(300 * MS));
  }

  @Test
  void rejectsWhileThrottling() {
    ThrottlingGuard guard = guard(true);
    AdmissionController controller = new AdmissionController(new QualityStateMachine(QualityLevel.HIGH), guard);
    memory.set(FixedMemoryProbe.mebibytes(250));
    guard.refreshMemory();

    assertEquals(AdmissionDecision.THROTTLED, controller.evaluate(0));
    assertEquals(0, controller.inFlight());

    memory.set(FixedMemoryProbe.mebibytes(100));
    guard.refreshMemory();
    assertEquals(AdmissionDecision.ADMITTED, controller.evaluate(0));
  }

  @Test
  void unmatchedCompletionsNeverGoNegative() {
    AdmissionController controller = controller(QualityLevel.HIGH, true);

    assertEquals(0, controller.completeAnalysis());
    assertEquals(0, controller.completeAnalysis());
    assertEquals(0, controller.inFlight());

    controller.beginAdmission(0);
    assertEquals(1, controller.inFlight());
    assertEquals(0, controller.completeAnalysis());
  }

  @Test
  void beginAdmissionStartsTheInterval() {
    AdmissionController controller = controller(QualityLevel.HIGH, true);
    controller.beginAdmission(100 * MS);

    assertEquals(AdmissionDecision.TOO_SOON, controller.evaluate(120 * MS));
  }

  @Test
  void resetForgetsLastAdmissionAndInFlight() {
    AdmissionController controller = controller(QualityLevel.HIGH, true);
    controller.shouldAdmit(500 * MS);
    controller.reset();

    assertEquals(0, controller.inFlight());
    assertTrue(controller.shouldAdmit(501 * MS));
  }

  @Test
  void concurrentCallersNeverExceedTheCap() throws Exception {
    AdmissionController controller = controller(QualityLevel.ULTRA, false);
    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger admitted = new AtomicInteger();
    try {
      for (int i = 0; i < threads; i++) {
        long now = i * 100 * MS;
        pool.execute(() -> {
          try {
            start.await();
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return;
          }
          if (controller.shouldAdmit(now)) {
            admitted.incrementAndGet();
          }
        });
      }
      start.countDown();
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
    assertTrue(admitted.get() <= QualityLevel.ULTRA.maxConcurrentAnalyzers());
    assertEquals(admitted.get(), controller.inFlight());
  }

  private AdmissionController controller(QualityLevel level, boolean throttling) {
    return new AdmissionController(new QualityStateMachine(level), guard(throttling));
  }

  private ThrottlingGuard guard(boolean enabled) {
    return new ThrottlingGuard(memory, Duration.ofMillis(33), FixedMemoryProbe.mebibytes(200), enabled);
  }
}
