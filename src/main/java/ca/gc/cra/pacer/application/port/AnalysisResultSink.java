package ca.gc.cra.pacer.application.port;

import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import java.util.List;

/**
 * Port receiving the results of each analyzed frame.
 * <p>Called from analyzer worker threads; implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AnalysisResultSink {
  /**
   * Accepts the results produced for one frame.
   *
   * @param results one result per analyzer that succeeded; never {@code null}
   */
  void accept(List<AnalysisResult> results);

  /** Sink that discards every result. */
  AnalysisResultSink DISCARD = results -> {};
}
