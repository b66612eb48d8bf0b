package ca.gc.cra.pacer.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pacer.application.governor.FrameGovernor;
import ca.gc.cra.pacer.application.governor.GovernorSettings;
import ca.gc.cra.pacer.application.port.AnalysisResultSink;
import ca.gc.cra.pacer.application.port.FrameAnalyzer;
import ca.gc.cra.pacer.application.port.FrameReleaseListener;
import ca.gc.cra.pacer.application.port.FrameSource;
import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import ca.gc.cra.pacer.domain.frame.FramePriority;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;
import ca.gc.cra.pacer.domain.metrics.PerformanceSnapshot;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.testing.FixedMemoryProbe;
import ca.gc.cra.pacer.testing.ManualClock;
import ca.gc.cra.pacer.testing.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongConsumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalysisPipelineTest {
  private static final PipelineSettings SETTINGS =
      new PipelineSettings(2, Duration.ofSeconds(5), Duration.ofMillis(500));

  private ManualClock clock;
  private RecordingMetricsPort metrics;
  private ReleaseTally<Long> releases;
  private FrameGovernor<Long> governor;

  @BeforeEach
  void setUp() {
    clock = new ManualClock();
    metrics = new RecordingMetricsPort();
    releases = new ReleaseTally<>();
    governor = new FrameGovernor<>(
        GovernorSettings.defaults(), clock, new FixedMemoryProbe(FixedMemoryProbe.mebibytes(32)), metrics, releases);
  }

  @Test
  void everyOfferedFrameIsConsumedOrDropped() throws Exception {
    ScriptedSource source = new ScriptedSource(clock, 60, Duration.ofMillis(20));
    List<List<AnalysisResult>> batches = new CopyOnWriteArrayList<>();
    AnalysisPipeline<Long> pipeline = pipeline(source, List.of(new EchoAnalyzer("exposure")), batches::add);

    AnalysisPipeline.RunSummary summary = pipeline.run();

    assertEquals(60L, summary.framesOffered());
    assertEquals(summary.framesAnalyzed(), releases.count(ReleaseReason.CONSUMED));
    assertEquals(60L, releases.count(ReleaseReason.CONSUMED) + releases.dropped());
    assertEquals(0L, releases.count(ReleaseReason.CLEARED));
    assertTrue(summary.framesAnalyzed() > 0);
    assertEquals(summary.framesAnalyzed(), batches.size());

    PerformanceSnapshot snapshot = governor.snapshot();
    assertEquals(60L, snapshot.totalFrames());
    assertEquals(0, snapshot.bufferedFrames());
    assertEquals(0, snapshot.inFlight());
    assertEquals(releases.dropped(), snapshot.droppedFrames());
    assertTrue(source.started.get());
    assertTrue(source.closed.get());
  }

  @Test
  void analyzerFailuresAreCountedAndStillCompleteTheSlot() throws Exception {
    ScriptedSource source = new ScriptedSource(clock, 30, Duration.ofMillis(60));
    FrameAnalyzer<Long> broken = new FrameAnalyzer<>() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public AnalysisResult analyze(Long frame, QualityLevel quality) {
        throw new IllegalStateException("sensor glitch");
      }
    };
    List<List<AnalysisResult>> batches = new CopyOnWriteArrayList<>();
    AnalysisPipeline<Long> pipeline = pipeline(source, List.of(broken, new EchoAnalyzer("focus")), batches::add);

    AnalysisPipeline.RunSummary summary = pipeline.run();

    assertTrue(summary.framesAnalyzed() > 0);
    assertEquals(summary.framesAnalyzed(), summary.analyzerFailures());
    assertEquals((int) summary.analyzerFailures(), metrics.count("pipeline.analyzer.failed"));
    assertEquals(0, governor.snapshot().inFlight());
    for (List<AnalysisResult> batch : batches) {
      assertEquals(1, batch.size());
      assertEquals("focus", batch.get(0).analyzer());
    }
  }

  @Test
  void sinkFailureDoesNotLoseTheFrame() throws Exception {
    ScriptedSource source = new ScriptedSource(clock, 10, Duration.ofMillis(60));
    AnalysisPipeline<Long> pipeline = pipeline(source, List.of(new EchoAnalyzer("composition")), results -> {
      throw new IllegalStateException("sink offline");
    });

    AnalysisPipeline.RunSummary summary = pipeline.run();

    assertEquals(summary.framesAnalyzed(), releases.count(ReleaseReason.CONSUMED));
    assertEquals(summary.framesAnalyzed(), metrics.count("pipeline.sink.failed"));
  }

  @Test
  void stopEndsCaptureLoop() throws Exception {
    ScriptedSource source = new ScriptedSource(clock, Long.MAX_VALUE, Duration.ofMillis(20));
    AtomicReference<AnalysisPipeline<Long>> holder = new AtomicReference<>();
    source.onPoll = produced -> {
      if (produced == 25) {
        holder.get().stop();
      }
    };
    holder.set(pipeline(source, List.of(new EchoAnalyzer("stability")), AnalysisResultSink.DISCARD));

    AnalysisPipeline.RunSummary summary = holder.get().run();

    assertEquals(25L, summary.framesOffered());
    assertEquals(25L, releases.count(ReleaseReason.CONSUMED) + releases.dropped());
  }

  @Test
  void requiresAtLeastOneAnalyzer() {
    ScriptedSource source = new ScriptedSource(clock, 1, Duration.ofMillis(20));
    assertThrows(IllegalArgumentException.class, () -> pipeline(source, List.of(), AnalysisResultSink.DISCARD));
  }

  private AnalysisPipeline<Long> pipeline(
      FrameSource<Long> source, List<FrameAnalyzer<Long>> analyzers, AnalysisResultSink sink) {
    return new AnalysisPipeline<>(
        "test", source, analyzers, governor, sink, FrameReleaseListener.ignoring(), metrics, clock, SETTINGS);
  }

  private static final class EchoAnalyzer implements FrameAnalyzer<Long> {
    private final String name;

    EchoAnalyzer(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public AnalysisResult analyze(Long frame, QualityLevel quality) {
      return new AnalysisResult(name, frame, quality, 0.5d, Map.of("sequence", frame));
    }
  }

  private static final class ScriptedSource implements FrameSource<Long> {
    private final ManualClock clock;
    private final long limit;
    private final Duration spacing;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private long produced;
    private LongConsumer onPoll = produced -> {};

    ScriptedSource(ManualClock clock, long limit, Duration spacing) {
      this.clock = clock;
      this.limit = limit;
      this.spacing = spacing;
    }

    @Override
    public void start() {
      started.set(true);
    }

    @Override
    public Optional<CapturedFrame<Long>> poll() {
      long now = clock.advance(spacing);
      produced++;
      FramePriority priority = produced % 5 == 0 ? FramePriority.HIGH : FramePriority.NORMAL;
      CapturedFrame<Long> frame = new CapturedFrame<>(now, now, priority);
      onPoll.accept(produced);
      return Optional.of(frame);
    }

    @Override
    public boolean isExhausted() {
      return produced >= limit;
    }

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
