package ca.gc.cra.helios.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.support.FitsFixtures;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class RunCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void incompleteConfigurationIsAConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, RunCli.run(new String[] {"run.start=2024-01-01"}));
    assertTrue(buffer.toString().contains("usage: run"));
  }

  @Test
  void malformedArgumentIsAConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, RunCli.run(new String[] {"run.start"}));
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}));
  }

  @Test
  void brokenYamlIsAConfigError() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("helios.yaml"), "run: [unclosed\n");

    assertEquals(ExitCode.CONFIG_ERROR, RunCli.run(new String[] {"config=" + yaml}));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void onceProcessesOneTickAndPersistsCursor() throws IOException {
    FitsFixtures.withQuality(tempDir.resolve("data/20240101_0000_0171.fits"), 0);
    Path script = tempDir.resolve("step.sh");
    Files.writeString(script, "#!/bin/sh\nexit 0\n");
    assertTrue(script.toFile().setExecutable(true));
    Path stateFile = tempDir.resolve("state/helios-state.json");
    Path yaml = Files.writeString(tempDir.resolve("helios.yaml"), String.join("\n",
        "common:",
        "  data:",
        "    filePattern: '" + tempDir + "/data/{date:yyyyMMdd_HHmm}_{channel:4}.fits'",
        "    hdu: 0",
        "run:",
        "  run:",
        "    start: '2024-01-01T00:00:00Z'",
        "    stateFile: '" + stateFile + "'",
        "  steps: [prep]",
        "  step:",
        "    prep:",
        "      executable: '" + script + "'",
        "      channels: [171]",
        ""));

    assertEquals(ExitCode.SUCCESS, RunCli.run(new String[] {"config=" + yaml, "--once"}));
    String state = Files.readString(stateFile);
    assertTrue(state.contains("2024-01-01T06:00:00Z"), state);

    assertEquals(ExitCode.PARTIAL_FAILURE, RunCli.run(new String[] {"config=" + yaml, "--once"}));
    assertTrue(Files.readString(stateFile).contains("2024-01-01T12:00:00Z"));
  }
}
