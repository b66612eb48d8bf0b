package ca.gc.cra.pacer.domain.analysis;

import ca.gc.cra.pacer.domain.quality.QualityLevel;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one analyzer run on one frame.
 *
 * @param analyzer analyzer name (for example {@code exposure})
 * @param frameTimestampNanos capture timestamp of the analyzed frame
 * @param quality quality level the frame was analyzed at
 * @param score analyzer-defined score in {@code [0, 1]}
 * @param attributes analyzer-specific values; copied on construction
 * @since PACER 0.1
 */
public record AnalysisResult(
    String analyzer,
    long frameTimestampNanos,
    QualityLevel quality,
    double score,
    Map<String, Object> attributes) {

  public AnalysisResult {
    Objects.requireNonNull(analyzer, "analyzer");
    Objects.requireNonNull(quality, "quality");
    if (Double.isNaN(score) || score < 0d || score > 1d) {
      throw new IllegalArgumentException("score must be within [0, 1] (was " + score + ")");
    }
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
