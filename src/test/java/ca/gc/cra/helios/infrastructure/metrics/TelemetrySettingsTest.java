package ca.gc.cra.helios.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {

  @Test
  void explicitValuesWin() {
    TelemetrySettings settings = TelemetrySettings.resolve("OTLP", " http://collector:4317 ", "team=solar");

    assertEquals(TelemetrySettings.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("team=solar", settings.resourceAttributes());
  }

  @Test
  void blankEndpointFallsBackToDefault() {
    TelemetrySettings settings = new TelemetrySettings(TelemetrySettings.ExporterMode.NONE, " ", null);

    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals("", settings.resourceAttributes());
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class, () -> TelemetrySettings.ExporterMode.parse("prometheus"));
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings(TelemetrySettings.ExporterMode.OTLP, "ftp://collector:4317", ""));
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings(TelemetrySettings.ExporterMode.OTLP, "http://", ""));
  }

  @Test
  void disabledSettingsExportNothing() {
    assertEquals(TelemetrySettings.ExporterMode.NONE, TelemetrySettings.disabled().exporter());
  }
}
