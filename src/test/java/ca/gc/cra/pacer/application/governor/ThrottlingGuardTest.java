package ca.gc.cra.pacer.application.governor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pacer.testing.FixedMemoryProbe;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ThrottlingGuardTest {
  private static final Duration BUDGET = Duration.ofMillis(33);
  private static final long CEILING = FixedMemoryProbe.mebibytes(200);

  private final FixedMemoryProbe memory = new FixedMemoryProbe(FixedMemoryProbe.mebibytes(120));

  @Test
  void throttlesAboveMemoryCeiling() {
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, true);
    guard.refreshMemory();
    assertFalse(guard.isThrottling());

    memory.set(CEILING + 1);
    assertFalse(guard.isThrottling(), "memory is read on refresh only");
    guard.refreshMemory();
    assertTrue(guard.isThrottling());
    assertEquals(CEILING + 1, guard.memoryBytes());
  }

  @Test
  void throttlesWhenRecentLatencyExceedsBudgetByHalf() {
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, true);

    guard.recordRecentLatency(BUDGET.toNanos() * 1.5);
    assertFalse(guard.isThrottling());

    guard.recordRecentLatency(BUDGET.toNanos() * 1.6);
    assertTrue(guard.isThrottling());

    guard.reset();
    assertFalse(guard.isThrottling());
  }

  @Test
  void disabledGuardNeverThrottles() {
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, false);
    memory.set(CEILING * 4);
    guard.refreshMemory();
    guard.recordRecentLatency(BUDGET.toNanos() * 10d);

    assertFalse(guard.isThrottling());
  }

  @Test
  void failedProbeReadingCountsAsZero() {
    ThrottlingGuard guard = new ThrottlingGuard(() -> -1L, BUDGET, CEILING, true);
    assertEquals(0L, guard.refreshMemory());
    assertFalse(guard.isThrottling());
  }

  @Test
  void logsOnlyOnStateTransitions() {
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, true);
    Logger logger = (Logger) LoggerFactory.getLogger(ThrottlingGuard.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    logger.setLevel(Level.INFO);
    appender.start();
    logger.addAppender(appender);
    try {
      memory.set(CEILING * 2);
      guard.refreshMemory();
      for (int i = 0; i < 5; i++) {
        assertTrue(guard.isThrottling());
      }
      memory.set(CEILING / 2);
      guard.refreshMemory();
      for (int i = 0; i < 5; i++) {
        assertFalse(guard.isThrottling());
      }
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    List<ILoggingEvent> events = appender.list;
    assertEquals(2, events.size(), () -> events.stream()
        .map(ILoggingEvent::getFormattedMessage)
        .collect(Collectors.joining("\n")));
    assertEquals(Level.WARN, events.get(0).getLevel());
    assertTrue(events.get(0).getFormattedMessage().startsWith("Throttling admission: memory usage"));
    assertEquals(Level.INFO, events.get(1).getLevel());
    assertEquals("Throttling cleared", events.get(1).getFormattedMessage());
  }

  @Test
  void configureRejectsNonPositiveThresholds() {
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, true);
    assertThrows(IllegalArgumentException.class, () -> guard.configure(Duration.ZERO, CEILING));
    assertThrows(IllegalArgumentException.class, () -> guard.configure(BUDGET, 0));
  }

  @Test
  void samplesMemoryOncePerInterval() {
    memory.set(FixedMemoryProbe.mebibytes(500));
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, true, Duration.ofMillis(500));

    assertTrue(guard.sampleMemoryIfDue(0L));
    assertTrue(guard.isThrottling());
    assertFalse(guard.sampleMemoryIfDue(Duration.ofMillis(499).toNanos()));
    assertEquals(1, memory.reads());

    memory.set(FixedMemoryProbe.mebibytes(100));
    assertTrue(guard.sampleMemoryIfDue(Duration.ofMillis(500).toNanos()));
    assertFalse(guard.isThrottling());
    assertEquals(2, memory.reads());
  }

  @Test
  void disabledGuardNeverSamples() {
    ThrottlingGuard guard = new ThrottlingGuard(memory, BUDGET, CEILING, false, Duration.ofMillis(500));

    assertFalse(guard.sampleMemoryIfDue(0L));
    assertEquals(0, memory.reads());
  }

  @Test
  void sampleIntervalMustBePositive() {
    assertThrows(IllegalArgumentException.class,
        () -> new ThrottlingGuard(memory, BUDGET, CEILING, true, Duration.ZERO));
  }
}
