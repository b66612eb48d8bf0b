package ca.gc.cra.pacer.application.port;

import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import ca.gc.cra.pacer.domain.quality.QualityLevel;

/**
 * <strong>What:</strong> Port for one per-frame analyzer (exposure, focus, composition...).
 * <p><strong>Role:</strong> Invoked by analysis workers for every frame taken from the store.</p>
 * <p><strong>Thread-safety:</strong> Implementations may be invoked from several workers at once.</p>
 * <p><strong>Performance:</strong> Expected to fit within the configured analysis budget; slow analyzers lower
 * the quality level.</p>
 *
 * @param <T> opaque frame handle type
 * @since 0.1.0
 */
public interface FrameAnalyzer<T> {
  /**
   * Returns a stable analyzer name used in results and logs.
   *
   * @return analyzer name
   */
  String name();

  /**
   * Analyzes one frame.
   *
   * @param frame frame handle; must not be retained after returning
   * @param quality quality level whose target resolution the frame should be analyzed at
   * @return analysis result
   * @throws Exception when the analysis fails; the pipeline logs and counts the failure
   */
  AnalysisResult analyze(T frame, QualityLevel quality) throws Exception;
}
