package ca.gc.cra.helios.infrastructure.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helios.domain.state.FailureCounter;
import ca.gc.cra.helios.domain.state.PipelineState;
import ca.gc.cra.helios.support.FakeClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonStateStoreTest {
  private static final Instant CURSOR = Instant.parse("2024-01-01T06:00:00Z");

  @TempDir Path tempDir;

  private Path file;
  private JsonStateStore store;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("state/helios-state.json");
    store = new JsonStateStore(file, new FakeClock(Instant.parse("2024-02-01T00:00:00Z")));
  }

  @Test
  void saveThenLoadKeepsCursorAndCounter() throws IOException {
    store.save(PipelineState.of(CURSOR, new FailureCounter(4)));

    PipelineState loaded = store.load().orElseThrow();

    assertEquals(CURSOR, loaded.cursor());
    assertEquals(4, loaded.failures().value());
    String json = Files.readString(file);
    assertTrue(json.contains("\"updatedAt\" : \"2024-02-01T00:00:00Z\""));
  }

  @Test
  void saveLeavesNoTemporaryFiles() throws IOException {
    store.save(PipelineState.of(CURSOR, FailureCounter.ZERO));
    store.save(PipelineState.of(CURSOR.plusSeconds(60), FailureCounter.ZERO));

    try (Stream<Path> files = Files.list(file.getParent())) {
      assertEquals(1, files.count());
    }
    assertEquals(CURSOR.plusSeconds(60), store.load().orElseThrow().cursor());
  }

  @Test
  void missingFileYieldsEmpty() {
    assertEquals(Optional.empty(), store.load());
  }

  @Test
  void corruptFileYieldsEmpty() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "{\"version\":1,\"cursor\":");

    assertEquals(Optional.empty(), store.load());
  }

  @Test
  void unsupportedVersionOrMissingCursorYieldsEmpty() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, "{\"version\":2,\"cursor\":\"2024-01-01T00:00:00Z\",\"failureCount\":1}");
    assertEquals(Optional.empty(), store.load());

    Files.writeString(file, "{\"version\":1,\"failureCount\":1}");
    assertEquals(Optional.empty(), store.load());

    Files.writeString(file, "{\"version\":1,\"cursor\":\"yesterday\"}");
    assertEquals(Optional.empty(), store.load());
  }

  @Test
  void unknownFieldsAreIgnoredAndNegativeCountClamped() throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file,
        "{\"version\":1,\"host\":{\"name\":\"x\"},\"cursor\":\"2024-01-01T06:00:00Z\",\"failureCount\":-3}");

    PipelineState loaded = store.load().orElseThrow();

    assertEquals(CURSOR, loaded.cursor());
    assertEquals(0, loaded.failures().value());
  }
}
