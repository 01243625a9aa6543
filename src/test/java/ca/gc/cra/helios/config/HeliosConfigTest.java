package ca.gc.cra.helios.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.infrastructure.metrics.TelemetrySettings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HeliosConfigTest {

  private static Map<String, String> minimal() {
    Map<String, String> map = new HashMap<>(DefaultsForMode.asFlatMap("run"));
    map.put("data.filePattern", "/data/{date:yyyy/MM/dd}/*_{channel:4}.fits");
    map.put("run.start", "2024-01-01");
    map.put("steps", "prep, stack");
    map.put("step.prep.executable", "/opt/prep");
    map.put("step.prep.channels", "171,193");
    map.put("step.prep.output", "/work/{date:yyyyMMdd_HHmm}_prep.fits");
    map.put("step.prep.options.config", "prep.cfg");
    map.put("step.prep.options.mode", "");
    map.put("step.stack.executable", "/opt/stack");
    map.put("step.stack.arguments", "@prep");
    map.put("step.stack.flagPrefix", "-");
    map.put("step.stack.allowPartialInputs", "true");
    map.put("step.stack.timeout", "PT10M");
    return map;
  }

  @Test
  void parsesCompleteConfiguration() {
    HeliosConfig config = HeliosConfig.fromMap(minimal());

    assertEquals("/data/{date:yyyy/MM/dd}/*_{channel:4}.fits", config.data().requireFilePattern().source());
    assertEquals(1, config.data().hdu());
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), config.run().start());
    assertEquals(Duration.ofHours(6), config.run().cadence());
    assertEquals(Path.of("helios-state.json"), config.run().stateFile());
    assertEquals(Optional.empty(), config.run().reportDir());
    assertEquals(NotifyConfig.NotifyMode.LOG, config.notification().mode());
    assertEquals(TelemetrySettings.ExporterMode.NONE, config.telemetry().exporter());

    StepConfig prep = config.steps().get(0);
    assertEquals("prep", prep.name());
    assertEquals(List.of(171, 193), prep.channels());
    assertEquals(List.of("images"), prep.arguments());
    assertEquals("--", prep.flagPrefix());
    assertEquals("output", prep.outputFlag());
    assertEquals(Map.of("config", "prep.cfg", "mode", ""), prep.options());
    assertFalse(prep.allowPartialInputs());
    assertEquals(Duration.ZERO, prep.timeout());

    StepConfig stack = config.steps().get(1);
    assertEquals(List.of("@prep"), stack.arguments());
    assertEquals("-", stack.flagPrefix());
    assertTrue(stack.allowPartialInputs());
    assertEquals(Duration.ofMinutes(10), stack.jobSpec().timeout());
  }

  @Test
  void requiresPatternStartAndSteps() {
    Map<String, String> noPattern = minimal();
    noPattern.put("data.filePattern", " ");
    assertEquals("data.filePattern is required",
        assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(noPattern)).getMessage());

    Map<String, String> noSteps = minimal();
    noSteps.put("steps", "");
    assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(noSteps));

    Map<String, String> noStart = minimal();
    noStart.remove("run.start");
    assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(noStart));
  }

  @Test
  void rejectsBadStepDefinitions() {
    Map<String, String> duplicate = minimal();
    duplicate.put("steps", "prep,prep");
    assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(duplicate));

    Map<String, String> noExecutable = minimal();
    noExecutable.remove("step.stack.executable");
    assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(noExecutable));

    assertThrows(IllegalArgumentException.class, () -> StepConfig.fromMap("bad name", minimal()));
  }

  @Test
  void imageStepNeedsChannelsWhenPatternUsesThem() {
    Map<String, String> noChannels = minimal();
    noChannels.remove("step.prep.channels");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(noChannels));
    assertEquals("step.prep.channels is required because data.filePattern contains {channel}", ex.getMessage());

    Map<String, String> channelFree = minimal();
    channelFree.remove("step.prep.channels");
    channelFree.put("data.filePattern", "/data/{date:yyyy/MM/dd}/*.fits");
    assertTrue(HeliosConfig.fromMap(channelFree).steps().get(0).channels().isEmpty());
  }

  @Test
  void rejectsOutOfRangeRunSettings() {
    Map<String, String> zeroCadence = minimal();
    zeroCadence.put("run.cadence", "PT0S");
    assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(zeroCadence));

    Map<String, String> tooManyWorkers = minimal();
    tooManyWorkers.put("run.lookupWorkers", "65");
    assertThrows(IllegalArgumentException.class, () -> HeliosConfig.fromMap(tooManyWorkers));

    Map<String, String> zeroDelay = minimal();
    zeroDelay.put("run.delay", "PT0S");
    assertEquals(Duration.ZERO, HeliosConfig.fromMap(zeroDelay).run().delay());
  }

  @Test
  void ignoreBitsMustBeWithinWord() {
    assertTrue(DataConfig.parseIgnoreSet("0, 8").contains(8));
    assertTrue(DataConfig.parseIgnoreSet("").bits().isEmpty());
    assertThrows(IllegalArgumentException.class, () -> DataConfig.parseIgnoreSet("32"));
    assertThrows(IllegalArgumentException.class, () -> DataConfig.parseIgnoreSet("x"));
  }
}
