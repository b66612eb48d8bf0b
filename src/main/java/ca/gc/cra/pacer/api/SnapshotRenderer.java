package ca.gc.cra.pacer.api;

import ca.gc.cra.pacer.domain.metrics.PerformanceSnapshot;
import ca.gc.cra.pacer.logging.Logs;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link PerformanceSnapshot} as aligned text lines or a single JSON object.
 */
final class SnapshotRenderer {
  private static final JsonFactory JSON = new JsonFactory();

  private SnapshotRenderer() {}

  static List<String> text(PerformanceSnapshot snapshot) {
    return List.of(
        "Performance snapshot",
        " Avg processing time : " + Logs.millis(snapshot.averageProcessingTime().toNanos()),
        " Estimated fps       : " + String.format(Locale.ROOT, "%.1f", snapshot.estimatedFrameRate()),
        " Dropped frames      : " + snapshot.droppedFrames() + " of " + snapshot.totalFrames()
            + " (" + Logs.percent(snapshot.droppedFramePercentage()) + ")",
        " Completed analyses  : " + snapshot.completedAnalyses(),
        " Memory              : " + Logs.mebibytes(snapshot.memoryUsageBytes()),
        " Quality level       : " + snapshot.qualityLevel(),
        " Throttling          : " + snapshot.throttling(),
        " In flight / buffered: " + snapshot.inFlight() + " / " + snapshot.bufferedFrames());
  }

  static String json(PerformanceSnapshot snapshot) {
    StringWriter out = new StringWriter(512);
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeNumberField("averageProcessingTimeNanos", snapshot.averageProcessingTime().toNanos());
      gen.writeNumberField("estimatedFrameRate", snapshot.estimatedFrameRate());
      gen.writeNumberField("droppedFramePercentage", snapshot.droppedFramePercentage());
      gen.writeNumberField("memoryUsageBytes", snapshot.memoryUsageBytes());
      gen.writeStringField("qualityLevel", snapshot.qualityLevel().name());
      gen.writeObjectFieldStart("targetResolution");
      gen.writeNumberField("width", snapshot.qualityLevel().targetResolution().width());
      gen.writeNumberField("height", snapshot.qualityLevel().targetResolution().height());
      gen.writeEndObject();
      gen.writeBooleanField("throttling", snapshot.throttling());
      gen.writeNumberField("inFlight", snapshot.inFlight());
      gen.writeNumberField("bufferedFrames", snapshot.bufferedFrames());
      gen.writeNumberField("totalFrames", snapshot.totalFrames());
      gen.writeNumberField("droppedFrames", snapshot.droppedFrames());
      gen.writeNumberField("completedAnalyses", snapshot.completedAnalyses());
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render snapshot as JSON", ex);
    }
    return out.toString();
  }
}
