package ca.gc.cra.pacer.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter selection for OpenTelemetry metrics.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param exportInterval periodic reader interval
 * @param resourceAttributes extra resource attributes in {@code key=value,key=value} form; may be blank
 * @since PACER 0.1
 */
public record TelemetrySettings(
    ExporterMode exporter, String endpoint, Duration exportInterval, String resourceAttributes) {

  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  /** Default export interval. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = (endpoint == null || endpoint.isBlank()) ? DEFAULT_ENDPOINT : endpoint.trim();
    exportInterval = exportInterval == null ? DEFAULT_INTERVAL : exportInterval;
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that disable exporting.
   *
   * @return exporter {@code none}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(ExporterMode.NONE, DEFAULT_ENDPOINT, DEFAULT_INTERVAL, "");
  }

  /**
   * Resolves settings from system properties, then environment variables, falling back to {@code none}.
   * <p>Reads {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER},
   * {@code otel.exporter.otlp.endpoint}/{@code OTEL_EXPORTER_OTLP_ENDPOINT}, and
   * {@code otel.resource.attributes}/{@code OTEL_RESOURCE_ATTRIBUTES}.</p>
   *
   * @return resolved settings
   */
  public static TelemetrySettings fromEnvironment() {
    String exporter = firstNonBlank(
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none");
    String endpoint = firstNonBlank(
        System.getProperty("otel.exporter.otlp.endpoint"),
        System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String attributes = firstNonBlank(
        System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new TelemetrySettings(ExporterMode.from(exporter), endpoint, DEFAULT_INTERVAL, attributes);
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  /** Supported metric exporters. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive; blank means {@code none}
     * @return exporter mode
     * @throws IllegalArgumentException for any other value
     */
    public static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("metricsExporter must be otlp or none (was " + raw + ")");
      };
    }
  }
}
