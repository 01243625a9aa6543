package ca.gc.cra.helios.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.application.job.ExternalJob;
import ca.gc.cra.helios.application.locate.FileLocator;
import ca.gc.cra.helios.domain.job.JobSpec;
import ca.gc.cra.helios.domain.locate.PathTemplate;
import ca.gc.cra.helios.domain.pipeline.StepRecord;
import ca.gc.cra.helios.domain.pipeline.TickOutcome;
import ca.gc.cra.helios.domain.quality.IgnoreSet;
import ca.gc.cra.helios.domain.quality.QualityGate;
import ca.gc.cra.helios.support.FakeClock;
import ca.gc.cra.helios.support.RecordingMetrics;
import ca.gc.cra.helios.support.ScriptedProcessRunner;
import ca.gc.cra.helios.support.StubFiles;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BackfillUseCaseTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  private final List<Instant> reported = new ArrayList<>();
  private ExecutorService pool;
  private RecordingMetrics metrics;
  private StubFiles files;
  private BackfillUseCase backfill;

  @BeforeEach
  void setUp() {
    files = new StubFiles()
        .file("/data/20240101_0000.fits", "/data/20240101_0000.fits", 0)
        .file("/data/20240101_1200.fits", "/data/20240101_1200.fits", 0x100);
    metrics = new RecordingMetrics();
    pool = Executors.newSingleThreadExecutor();
    FileLocator locator = new FileLocator(
        PathTemplate.parse("/data/{date:yyyyMMdd_HHmm}.fits"), new QualityGate(IgnoreSet.DEFAULT), files, files,
        metrics);
    ExternalJob job = new ExternalJob(
        new JobSpec("prep", "prep", Map.of()), "output", new ScriptedProcessRunner().succeed("prep"),
        new FakeClock(START), metrics);
    Pipeline pipeline = new Pipeline(List.of(new PipelineStep("prep", job, List.of(), List.of("images"), null, false)));
    backfill = new BackfillUseCase(new TickRunner(locator, pipeline, pool), (tick, values) -> reported.add(tick), metrics);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void runsEveryTickInHalfOpenInterval() throws InterruptedException {
    BackfillUseCase.Result result = backfill.run(START, START.plus(Duration.ofHours(18)), Duration.ofHours(6));

    assertEquals(3, result.outcomes().size());
    assertEquals(START.plus(Duration.ofHours(12)), result.outcomes().get(2).tick());
    assertEquals(1, result.failedCount());
    assertFalse(result.allSucceeded());
    assertEquals(List.of(START, START.plus(Duration.ofHours(12))), reported);
    assertEquals(1, metrics.count("scheduler.tick.failed"));
  }

  @Test
  void unexpectedErrorFailsOnlyThatTick() throws InterruptedException {
    files.failListing("/data/20240101_0600.fits", new IllegalStateException("index corrupted"));

    BackfillUseCase.Result result = backfill.run(START, START.plus(Duration.ofHours(18)), Duration.ofHours(6));

    assertEquals(3, result.outcomes().size());
    TickOutcome broken = result.outcomes().get(1);
    assertFalse(broken.success());
    assertEquals(Optional.of("index corrupted"), broken.firstFailure().map(StepRecord::message));
    assertEquals(List.of(START, START.plus(Duration.ofHours(12))), reported);
  }

  @Test
  void emptyIntervalRunsNothing() throws InterruptedException {
    assertTrue(backfill.run(START, START, Duration.ofHours(6)).allSucceeded());
  }

  @Test
  void invalidIntervalIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> backfill.run(START, START.minusSeconds(1), Duration.ofHours(6)));
    assertThrows(IllegalArgumentException.class, () -> backfill.run(START, START, Duration.ZERO));
  }
}
