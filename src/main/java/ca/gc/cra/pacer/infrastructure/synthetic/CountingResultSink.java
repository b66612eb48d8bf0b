package ca.gc.cra.pacer.infrastructure.synthetic;

import ca.gc.cra.pacer.application.port.AnalysisResultSink;
import ca.gc.cra.pacer.domain.analysis.AnalysisResult;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts results and logs each batch at TRACE.
 *
 * @since PACER 0.1
 */
public final class CountingResultSink implements AnalysisResultSink {
  private static final Logger log = LoggerFactory.getLogger(CountingResultSink.class);

  private final LongAdder batches = new LongAdder();
  private final LongAdder results = new LongAdder();

  @Override
  public void accept(List<AnalysisResult> batch) {
    batches.increment();
    results.add(batch.size());
    if (log.isTraceEnabled()) {
      for (AnalysisResult result : batch) {
        log.trace("{} scored {} at {}", result.analyzer(), result.score(), result.quality());
      }
    }
  }

  public long batches() {
    return batches.sum();
  }

  public long results() {
    return results.sum();
  }
}
