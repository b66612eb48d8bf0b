package ca.gc.cra.pacer.application.pipeline;

import ca.gc.cra.pacer.application.governor.AdmissionDecision;
import ca.gc.cra.pacer.application.governor.FrameGovernor;
import ca.gc.cra.pacer.application.port.AnalysisResultSink;
import ca.gc.cra.pacer.application.port.ClockPort;
import ca.gc.cra.pacer.application.port.FrameAnalyzer;
import ca.gc.cra.pacer.application.port.FrameReleaseListener;
import ca.gc.cra.pacer.application.port.FrameSource;
import ca.gc.cra.pacer.application.port.MetricsPort;
import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives frames from a {@link FrameSource} through the governor into a pool of analyzer workers.
 * <p>The capture loop runs on the caller's thread and only calls
 * {@link FrameGovernor#offerFrame(Object, long, ca.gc.cra.pacer.domain.frame.FramePriority)}. Workers take the
 * highest priority buffered frame, run every analyzer on it at the current quality level, report the elapsed
 * time through {@link FrameGovernor#endAnalysis(Duration)}, and hand the results to the sink. Every frame the
 * source produced ends up either {@link ReleaseReason#CONSUMED consumed} or released by the governor as dropped.
 * </p>
 * <p>Instances are not reusable; invoke {@link #run()} at most once at a time.</p>
 *
 * @param <T> frame handle type
 * @since PACER 0.1
 */
public final class AnalysisPipeline<T> {
  private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);

  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final String name;
  private final FrameSource<T> source;
  private final List<FrameAnalyzer<T>> analyzers;
  private final FrameGovernor<T> governor;
  private final AnalysisResultSink sink;
  private final FrameReleaseListener<T> releaseListener;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final PipelineSettings settings;

  private final Semaphore framesAvailable = new Semaphore(0);
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicBoolean drainRequested = new AtomicBoolean();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final AtomicReference<Throwable> workerFailure = new AtomicReference<>();
  private final LongAdder offered = new LongAdder();
  private final LongAdder consumed = new LongAdder();
  private final LongAdder analyzerFailures = new LongAdder();
  private final String workerThreadPrefix;
  private final UncaughtExceptionHandler workerUncaughtHandler;

  /**
   * Creates the pipeline.
   *
   * @param name pipeline name, used for the {@code pipeline} MDC key
   * @param source frame producer
   * @param analyzers analyzers run on each admitted frame, in order
   * @param governor governor deciding admission; must share {@code releaseListener}
   * @param sink receives the results of each analyzed frame
   * @param releaseListener notified with {@link ReleaseReason#CONSUMED} after analysis
   * @param metrics metrics sink
   * @param clock monotonic clock used to time analyses
   * @param settings worker and monitor tuning
   */
  public AnalysisPipeline(
      String name,
      FrameSource<T> source,
      List<FrameAnalyzer<T>> analyzers,
      FrameGovernor<T> governor,
      AnalysisResultSink sink,
      FrameReleaseListener<T> releaseListener,
      MetricsPort metrics,
      ClockPort clock,
      PipelineSettings settings) {
    this.name = Objects.requireNonNull(name, "name");
    this.source = Objects.requireNonNull(source, "source");
    this.analyzers = List.copyOf(Objects.requireNonNull(analyzers, "analyzers"));
    if (this.analyzers.isEmpty()) {
      throw new IllegalArgumentException("at least one analyzer is required");
    }
    this.governor = Objects.requireNonNull(governor, "governor");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.releaseListener = Objects.requireNonNull(releaseListener, "releaseListener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.workerThreadPrefix = "pacer-analyze-" + Integer.toHexString(System.identityHashCode(this));
    this.workerUncaughtHandler = this::handleWorkerCrash;
  }

  /**
   * Runs the capture loop until the source is exhausted, {@link #stop()} is called, or the thread is interrupted.
   * Buffered frames are analyzed before the method returns.
   *
   * @return summary of the run
   * @throws Exception if the source fails or a worker crashed
   */
  public RunSummary run() throws Exception {
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("Pipeline " + name + " already running");
    }
    MDC.put("pipeline", name);
    PerformanceMonitor monitor =
        new PerformanceMonitor(governor, metrics, settings.monitorInterval(), settings.memorySampleInterval());
    ExecutorService workers = null;
    boolean started = false;
    Exception primaryFailure = null;
    try {
      stopRequested.set(false);
      drainRequested.set(false);
      workerFailure.set(null);
      workers = startWorkers();
      monitor.start();
      source.start();
      started = true;
      log.info(
          "Pipeline {} started with {} analyzers on {} workers at quality {}",
          name,
          analyzers.size(),
          settings.analysisWorkers(),
          governor.qualityLevel());

      while (!stopRequested.get() && !Thread.currentThread().isInterrupted() && !source.isExhausted()) {
        if (workerFailure.get() != null) {
          break;
        }
        Optional<CapturedFrame<T>> maybeFrame;
        try {
          maybeFrame = source.poll();
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
        if (maybeFrame.isEmpty()) {
          continue;
        }
        CapturedFrame<T> frame = maybeFrame.get();
        offered.increment();
        AdmissionDecision decision = governor.offerFrame(frame.handle(), frame.timestampNanos(), frame.priority());
        if (decision.admitted()) {
          framesAvailable.release();
        } else {
          log.trace("Frame at {} rejected: {}", frame.timestampNanos(), decision);
        }
      }
    } catch (Exception runFailure) {
      primaryFailure = runFailure;
    } finally {
      Exception shutdownFailure = shutdownWorkers(workers);
      if (primaryFailure == null) {
        primaryFailure = shutdownFailure;
      }
      monitor.close();
      if (started) {
        try {
          source.close();
          log.debug("Frame source closed");
        } catch (Exception closeFailure) {
          log.error("Failed to close frame source", closeFailure);
          if (primaryFailure == null) {
            primaryFailure = closeFailure;
          }
        }
      }
      runThread.set(null);
    }
    try {
      if (primaryFailure != null) {
        log.debug("Pipeline {} terminating after {} frames due to failure", name, offered.sum());
        throw primaryFailure;
      }
      RunSummary summary = new RunSummary(offered.sum(), consumed.sum(), analyzerFailures.sum());
      log.info(
          "Pipeline {} completed; offered {} frames, analyzed {}, analyzer failures {}",
          name,
          summary.framesOffered(),
          summary.framesAnalyzed(),
          summary.analyzerFailures());
      return summary;
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Asks the capture loop to stop after the current frame. Buffered frames are still analyzed.
   */
  public void stop() {
    stopRequested.set(true);
  }

  private ExecutorService startWorkers() {
    int count = settings.analysisWorkers();
    ExecutorService executor = ExecutorFactories.newAnalyzerPool(count, workerThreadPrefix, workerUncaughtHandler);
    for (int i = 0; i < count; i++) {
      executor.execute(new AnalysisWorker());
    }
    log.debug("Started {} analyzer workers", count);
    return executor;
  }

  private Exception shutdownWorkers(ExecutorService executor) {
    if (executor == null) {
      return null;
    }
    drainRequested.set(true);
    framesAvailable.release(settings.analysisWorkers());
    executor.shutdown();
    boolean terminated = false;
    try {
      terminated = executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!terminated) {
        log.warn("Analyzer workers active after {} ms; forcing shutdown", WORKER_SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
        terminated = executor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException ie) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (!terminated) {
      log.error("Analyzer workers failed to terminate cleanly");
    }
    Throwable failure = workerFailure.get();
    if (failure == null) {
      return null;
    }
    return failure instanceof Exception ex ? ex : new IllegalStateException("Analyzer worker crashed", failure);
  }

  private final class AnalysisWorker implements Runnable {
    @Override
    public void run() {
      MDC.put("pipeline", name);
      try {
        while (true) {
          Optional<CapturedFrame<T>> next = governor.takeNextFrame();
          if (next.isPresent()) {
            analyze(next.get());
            continue;
          }
          if (drainRequested.get()) {
            return;
          }
          framesAvailable.tryAcquire(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      } finally {
        MDC.remove("pipeline");
      }
    }
  }

  private void analyze(CapturedFrame<T> frame) {
    QualityLevel quality = governor.qualityLevel();
    List<AnalysisResult> results = new ArrayList<>(analyzers.size());
    long startNanos = clock.nanoTime();
    try {
      for (FrameAnalyzer<T> analyzer : analyzers) {
        try {
          results.add(analyzer.analyze(frame.handle(), quality));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        } catch (Exception ex) {
          analyzerFailures.increment();
          metrics.increment("pipeline.analyzer.failed");
          log.warn("Analyzer {} failed on frame at {}", analyzer.name(), frame.timestampNanos(), ex);
        }
      }
    } finally {
      governor.endAnalysis(Duration.ofNanos(clock.nanoTime() - startNanos));
    }
    if (!results.isEmpty()) {
      try {
        sink.accept(List.copyOf(results));
      } catch (RuntimeException ex) {
        metrics.increment("pipeline.sink.failed");
        log.warn("Result sink failed for frame at {}", frame.timestampNanos(), ex);
      }
    }
    consumed.increment();
    try {
      releaseListener.onReleased(frame, ReleaseReason.CONSUMED);
    } catch (RuntimeException ex) {
      log.warn("Frame release listener failed for consumed frame at {}", frame.timestampNanos(), ex);
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    log.error("Analyzer worker {} threw an uncaught exception", thread.getName(), throwable);
    if (workerFailure.compareAndSet(null, throwable)) {
      stopRequested.set(true);
    }
  }

  /**
   * Totals for one pipeline run.
   *
   * @param framesOffered frames produced by the source and offered to the governor
   * @param framesAnalyzed frames taken from the store and analyzed
   * @param analyzerFailures analyzer invocations that threw
   */
  public record RunSummary(long framesOffered, long framesAnalyzed, long analyzerFailures) {}
}
