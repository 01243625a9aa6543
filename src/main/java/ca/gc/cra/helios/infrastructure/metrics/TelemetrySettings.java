package ca.gc.cra.helios.infrastructure.metrics;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * Metrics export settings resolved from configuration, system properties, and the standard
 * {@code OTEL_*} environment variables (in that order).
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma-separated {@code key=value} resource attributes, possibly blank
 * @since 0.1.0
 */
public record TelemetrySettings(ExporterMode exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException if the endpoint is not an http(s) URI with a host
   */
  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    if (exporter == ExporterMode.OTLP) {
      validateEndpoint(endpoint);
    }
  }

  /** Settings that disable export entirely. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(ExporterMode.NONE, DEFAULT_ENDPOINT, "");
  }

  /**
   * Resolves settings, letting explicit values win over JVM properties and environment variables.
   *
   * @param exporter configured exporter name, or {@code null}/blank to fall back
   * @param endpoint configured endpoint, or {@code null}/blank to fall back
   * @param resourceAttributes configured attributes, or {@code null}/blank to fall back
   * @return resolved settings
   * @throws IllegalArgumentException if the exporter name or endpoint is invalid
   */
  public static TelemetrySettings resolve(String exporter, String endpoint, String resourceAttributes) {
    String exporterValue = firstNonBlank(
        exporter, System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none");
    String endpointValue = firstNonBlank(
        endpoint,
        System.getProperty("otel.exporter.otlp.endpoint"),
        System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String attributes = firstNonBlank(
        resourceAttributes,
        System.getProperty("otel.resource.attributes"),
        System.getenv("OTEL_RESOURCE_ATTRIBUTES"),
        "");
    return new TelemetrySettings(ExporterMode.parse(exporterValue), endpointValue, attributes);
  }

  private static String firstNonBlank(String first, String second, String third, String fallback) {
    for (String candidate : new String[] {first, second, third}) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return fallback;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  /** Supported exporters. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code otlp} or {@code none}, case-insensitive
     * @return exporter mode
     * @throws IllegalArgumentException for any other value
     */
    public static ExporterMode parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none", "" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was " + raw + ")");
      };
    }
  }
}
