package ca.gc.cra.helios.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.domain.quality.IgnoreSet;
import ca.gc.cra.helios.domain.quality.QualityGate;
import ca.gc.cra.helios.support.FitsFixtures;
import ca.gc.cra.helios.support.StubFiles;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QualityCliTest {
  private static final String GLOB = "/data/2024/01/01/*.fits";
  private static final QualityGate GATE = new QualityGate(IgnoreSet.DEFAULT);

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
  void cleanFileIsGood() {
    StubFiles files = new StubFiles().file(GLOB, "/data/a.fits", 0);

    QualityCli.Verdict verdict = QualityCli.verdict(Path.of("/data/a.fits"), files, GATE);

    assertEquals(new QualityCli.Verdict("/data/a.fits is good quality", true), verdict);
  }

  @Test
  void toleratedBitsAreReportedButGood() {
    StubFiles files = new StubFiles().file(GLOB, "/data/a.fits", 0b1_0000_0001);

    QualityCli.Verdict verdict = QualityCli.verdict(Path.of("/data/a.fits"), files, GATE);

    assertTrue(verdict.good());
    assertEquals("/data/a.fits is good quality, BUT: FLAT_REC == MISSING (Flatfield data not available), "
        + "MISSVALS > 0", verdict.line());
  }

  @Test
  void untoleratedBitMakesFileBad() {
    StubFiles files = new StubFiles().file(GLOB, "/data/a.fits", 1L << 12 | 1L << 5);

    QualityCli.Verdict verdict = QualityCli.verdict(Path.of("/data/a.fits"), files, GATE);

    assertFalse(verdict.good());
    assertEquals("/data/a.fits is bad quality: Unknown error, "
        + "ACS_MODE != \"SCIENCE\" (Spacecraft not in science pointing mode)", verdict.line());
  }

  @Test
  void unreadableMissingOrInvalidValuesAreErrors() {
    StubFiles files = new StubFiles()
        .unreadable(GLOB, "/data/corrupt.fits")
        .fileWithoutKeyword(GLOB, "/data/bare.fits")
        .file(GLOB, "/data/huge.fits", 1L << 40);

    for (String name : List.of("/data/corrupt.fits", "/data/bare.fits", "/data/huge.fits")) {
      QualityCli.Verdict verdict = QualityCli.verdict(Path.of(name), files, GATE);
      assertEquals("Error reading quality for file " + name, verdict.line());
      assertFalse(verdict.good());
    }
  }

  @Test
  void reportPrintsOneLinePerFile() {
    StubFiles files = new StubFiles()
        .file(GLOB, "/data/a.fits", 0)
        .file(GLOB, "/data/b.fits", 1L << 31);

    ExitCode exit = QualityCli.report(GLOB, files, files, GATE);

    assertEquals(ExitCode.PARTIAL_FAILURE, exit);
    String[] lines = buffer.toString().split("\\R");
    assertEquals(2, lines.length);
    assertEquals("/data/a.fits is good quality", lines[0]);
    assertEquals("/data/b.fits is bad quality: Image not available", lines[1]);
  }

  @Test
  void reportWithoutMatchesSaysSo() {
    assertEquals(ExitCode.PARTIAL_FAILURE, QualityCli.report(GLOB, new StubFiles(), new StubFiles(), GATE));
    assertEquals(LocateCli.NOT_FOUND, buffer.toString().trim());
  }

  @Test
  void runReadsRealHeaders() throws IOException {
    FitsFixtures.withQuality(tempDir.resolve("img_0171.fits"), 0);
    FitsFixtures.withQuality(tempDir.resolve("img_0193.fits"), 1);

    ExitCode exit = QualityCli.run(new String[] {"file=" + tempDir + "/img_*.fits", "data.hdu=0"});

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(buffer.toString().contains("img_0171.fits is good quality"));
    assertTrue(buffer.toString().contains("img_0193.fits is good quality, BUT: FLAT_REC == MISSING"));
  }

  @Test
  void runRequiresFileArgument() {
    assertEquals(ExitCode.INVALID_ARGS, QualityCli.run(new String[] {"data.hdu=0"}));
  }
}
