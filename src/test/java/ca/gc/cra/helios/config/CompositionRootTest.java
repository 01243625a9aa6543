package ca.gc.cra.helios.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.application.pipeline.SchedulerUseCase;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import ca.gc.cra.helios.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.helios.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.helios.support.FakeClock;
import ca.gc.cra.helios.support.FitsFixtures;
import ca.gc.cra.helios.support.RecordingMetrics;
import ca.gc.cra.helios.support.ScriptedProcessRunner;
import ca.gc.cra.helios.support.StubFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  private static final Instant TICK = Instant.parse("2024-01-01T00:00:00Z");

  @TempDir Path tempDir;

  private HeliosConfig config() {
    Map<String, String> map = new HashMap<>(DefaultsForMode.asFlatMap("run"));
    map.put("data.filePattern", tempDir + "/data/{date:yyyyMMdd_HHmm}_{channel:4}.fits");
    map.put("run.start", TICK.toString());
    map.put("run.stateFile", tempDir.resolve("helios-state.json").toString());
    map.put("run.reportDir", tempDir.resolve("reports").toString());
    map.put("steps", "prep,stack");
    map.put("step.prep.executable", "prep");
    map.put("step.prep.channels", "171");
    map.put("step.prep.output", tempDir + "/work/{date:yyyyMMdd_HHmm}_prep.fits");
    map.put("step.stack.executable", "stack");
    map.put("step.stack.arguments", "@prep");
    return HeliosConfig.fromMap(map);
  }

  @Test
  void wiresLocatorPipelineAndScheduler() throws Exception {
    Path image = tempDir.resolve("data/20240101_0000_0171.fits");
    Files.createDirectories(image.getParent());
    Files.writeString(image, "");
    StubFiles headers = new StubFiles().file("unused", image.toString(), 0);
    ScriptedProcessRunner runner = new ScriptedProcessRunner().succeed("prep").succeedWithoutArtifact("stack");
    FakeClock clock = new FakeClock(Instant.parse("2024-03-01T00:00:00Z"));
    HeliosConfig config = config();

    try (CompositionRoot root = new CompositionRoot(config, new RecordingMetrics(), runner, headers, clock)) {
      SchedulerUseCase scheduler = root.schedulerUseCase();
      TickOutcome outcome = scheduler.runOnce();

      assertTrue(outcome.success());
      Path artifact = tempDir.resolve("work/20240101_0000_prep.fits");
      assertEquals(List.of(List.of("stack", artifact.toString())), runner.invocationsOf("stack"));
      assertEquals(TICK.plus(config.run().cadence()), scheduler.state().cursor());
      assertTrue(Files.readString(tempDir.resolve("helios-state.json")).contains("2024-01-01T06:00:00Z"));
      assertTrue(Files.exists(tempDir.resolve("reports/20240101_000000.csv")));
    }
  }

  @Test
  void closeIsIdempotent() {
    CompositionRoot root = new CompositionRoot(
        config(), new RecordingMetrics(), new ScriptedProcessRunner(), new StubFiles(), new FakeClock(TICK));

    root.close();
    root.close();
  }

  @Test
  void disabledTelemetryUsesNoOpMetrics() {
    assertInstanceOf(NoOpMetricsAdapter.class, CompositionRoot.metricsFor(TelemetrySettings.disabled()));
  }

  @Test
  void qualityReaderFollowsDataSettings() throws IOException {
    Path fits = FitsFixtures.withQuality(tempDir.resolve("a.fits"), 7);
    DataConfig data = DataConfig.fromMap(Map.of("data.hdu", "0"));

    assertEquals(7L, CompositionRoot.qualityReader(data).readQuality(fits).orElseThrow());
  }
}
