package ca.gc.cra.pacer.infrastructure.synthetic;

import ca.gc.cra.pacer.application.port.FrameAnalyzer;
import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import ca.gc.cra.pacer.domain.quality.QualityLevel;
import ca.gc.cra.pacer.domain.quality.Resolution;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

/**
 * Analyzer that sleeps for a latency proportional to the pixels processed at the current quality level.
 * <p>{@code baseLatency} is the cost at {@link QualityLevel#HIGH}; other levels scale it by their pixel count
 * relative to HIGH, so lowering quality shortens analyses the way downscaled input does for real analyzers. A
 * uniform jitter in {@code [0, jitter]} is added.</p>
 *
 * @since PACER 0.1
 */
public final class SyntheticLatencyAnalyzer implements FrameAnalyzer<SyntheticFrame> {
  private static final double REFERENCE_PIXELS = pixels(QualityLevel.HIGH.targetResolution());

  private final String name;
  private final long baseLatencyNanos;
  private final long jitterNanos;
  private final SplittableRandom random;

  /**
   * Creates an analyzer.
   *
   * @param name analyzer name reported in results
   * @param baseLatency latency at HIGH quality
   * @param jitter maximum random latency added
   * @param seed random seed
   */
  public SyntheticLatencyAnalyzer(String name, Duration baseLatency, Duration jitter, long seed) {
    this.name = Objects.requireNonNull(name, "name");
    this.baseLatencyNanos = Objects.requireNonNull(baseLatency, "baseLatency").toNanos();
    this.jitterNanos = Objects.requireNonNull(jitter, "jitter").toNanos();
    if (baseLatencyNanos < 0 || jitterNanos < 0) {
      throw new IllegalArgumentException("latency and jitter must not be negative");
    }
    this.random = new SplittableRandom(seed);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public AnalysisResult analyze(SyntheticFrame frame, QualityLevel quality) throws InterruptedException {
    long latency = latencyFor(quality);
    double score;
    synchronized (random) {
      if (jitterNanos > 0) {
        latency += random.nextLong(jitterNanos + 1);
      }
      score = random.nextDouble();
    }
    TimeUnit.NANOSECONDS.sleep(latency);
    Resolution resolution = quality.targetResolution();
    double scale = resolution.downscaleFactor(frame.width(), frame.height());
    return new AnalysisResult(
        name,
        frame.capturedAtNanos(),
        quality,
        score,
        Map.of(
            "sequence", frame.sequence(),
            "latencyNanos", latency,
            "scale", scale,
            "resolution", resolution.toString()));
  }

  long latencyFor(QualityLevel quality) {
    return Math.round(baseLatencyNanos * (pixels(quality.targetResolution()) / REFERENCE_PIXELS));
  }

  private static double pixels(Resolution resolution) {
    return (double) resolution.width() * resolution.height();
  }
}
