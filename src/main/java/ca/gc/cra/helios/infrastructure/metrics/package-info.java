/**
 * OpenTelemetry and no-op implementations of {@link ca.gc.cra.helios.application.port.MetricsPort}.
 * <p><strong>Configuration:</strong> {@code metricsExporter}, {@code otelEndpoint}, and
 * {@code otelResourceAttributes}, falling back to the standard {@code OTEL_*} variables.</p>
 */
package ca.gc.cra.helios.infrastructure.metrics;
