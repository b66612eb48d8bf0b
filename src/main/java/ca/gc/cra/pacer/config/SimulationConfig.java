package ca.gc.cra.pacer.config;

import ca.gc.cra.pacer.validation.Numbers;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Synthetic load parameters for the {@code simulate} command.
 *
 * @param sourceFps synthetic camera frame rate
 * @param duration run length; {@link Duration#ZERO} when bounded by {@code frames} only
 * @param frames frame limit; {@code 0} when bounded by {@code duration} only
 * @param highPriorityEvery every n-th frame is HIGH priority ({@code 0} disables)
 * @param lowPriorityEvery every n-th remaining frame is LOW priority ({@code 0} disables)
 * @param analyzers number of synthetic analyzers run per frame
 * @param analyzerLatency per-analyzer latency at HIGH quality
 * @param analyzerJitter maximum random latency added per analysis
 * @param seed random seed for jitter and scores
 * @param output snapshot output format
 * @since PACER 0.1
 */
public record SimulationConfig(
    double sourceFps,
    Duration duration,
    long frames,
    int highPriorityEvery,
    int lowPriorityEvery,
    int analyzers,
    Duration analyzerLatency,
    Duration analyzerJitter,
    long seed,
    OutputFormat output) {

  public SimulationConfig {
    Objects.requireNonNull(duration, "duration");
    Objects.requireNonNull(analyzerLatency, "analyzerLatency");
    Objects.requireNonNull(analyzerJitter, "analyzerJitter");
    Objects.requireNonNull(output, "output");
    if (frames == 0 && duration.isZero()) {
      throw new IllegalArgumentException("durationMs or frames must be positive");
    }
  }

  /**
   * Parses the simulation keys: {@code sourceFps} (default 30), {@code durationMs} (10000), {@code frames} (0),
   * {@code highPriorityEvery} (10), {@code lowPriorityEvery} (3), {@code analyzers} (3),
   * {@code analyzerLatencyMs} (8), {@code analyzerJitterMs} (4), {@code seed} (42), {@code output}
   * ({@code text}).
   *
   * @param kv flat key/value map; {@code null} means defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static SimulationConfig fromMap(Map<String, String> kv) {
    Map<String, String> map = kv == null ? Map.of() : kv;
    double fps = Numbers.parseDouble("sourceFps", map.get("sourceFps"), 30d, 0d, 1_000d);
    long frames = Numbers.parseLong("frames", map.get("frames"), 0L, 0L, 10_000_000L);
    long defaultDuration = frames > 0 ? 0L : 10_000L;
    long durationMs = Numbers.parseLong("durationMs", map.get("durationMs"), defaultDuration, 0L, 86_400_000L);
    int high = (int) Numbers.parseLong("highPriorityEvery", map.get("highPriorityEvery"), 10L, 0L, 1_000_000L);
    int low = (int) Numbers.parseLong("lowPriorityEvery", map.get("lowPriorityEvery"), 3L, 0L, 1_000_000L);
    int analyzers = (int) Numbers.parseLong("analyzers", map.get("analyzers"), 3L, 1L, 16L);
    long latencyMs = Numbers.parseLong("analyzerLatencyMs", map.get("analyzerLatencyMs"), 8L, 0L, 10_000L);
    long jitterMs = Numbers.parseLong("analyzerJitterMs", map.get("analyzerJitterMs"), 4L, 0L, 10_000L);
    long seed = Numbers.parseLong("seed", map.get("seed"), 42L, Long.MIN_VALUE, Long.MAX_VALUE);
    OutputFormat output = OutputFormat.fromString(map.get("output"));
    return new SimulationConfig(
        fps,
        Duration.ofMillis(durationMs),
        frames,
        high,
        low,
        analyzers,
        Duration.ofMillis(latencyMs),
        Duration.ofMillis(jitterMs),
        seed,
        output);
  }

  /** Snapshot output formats. */
  public enum OutputFormat {
    TEXT,
    JSON;

    /**
     * Parses an output format.
     *
     * @param raw {@code text} or {@code json}; blank means text
     * @return format
     * @throws IllegalArgumentException for other values
     */
    public static OutputFormat fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        return TEXT;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "text" -> TEXT;
        case "json" -> JSON;
        default -> throw new IllegalArgumentException("output must be text or json (was " + raw + ")");
      };
    }
  }
}
