package ca.gc.cra.pacer.api;

import ca.gc.cra.pacer.application.port.MetricsPort;
import ca.gc.cra.pacer.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.pacer.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pacer.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.pacer.infrastructure.metrics.TelemetrySettings.ExporterMode;
import ca.gc.cra.pacer.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves metrics exporter settings from CLI keys, falling back to {@code otel.*} system properties and
 * {@code OTEL_*} environment variables.
 * <p>Consumes {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} from the map so
 * they do not reach the governor configuration.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings resolve(Map<String, String> args) {
    TelemetrySettings base = TelemetrySettings.fromEnvironment();
    ExporterMode exporter = base.exporter();
    String endpoint = base.endpoint();
    String attributes = base.resourceAttributes();

    String rawExporter = args.remove("metricsExporter");
    if (rawExporter != null) {
      exporter = ExporterMode.from(rawExporter);
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    }
    String rawEndpoint = args.remove("otelEndpoint");
    if (rawEndpoint != null) {
      endpoint = validateEndpoint(rawEndpoint.trim());
    }
    String rawAttributes = args.remove("otelResourceAttributes");
    if (rawAttributes != null) {
      attributes = Strings.requirePrintableAscii(
          "otelResourceAttributes", rawAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return new TelemetrySettings(exporter, endpoint, base.exportInterval(), attributes);
  }

  static MetricsPort createMetrics(TelemetrySettings settings) {
    if (settings.exporter() == ExporterMode.NONE) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  private static String validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
      return raw;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
