package ca.gc.cra.helios.infrastructure.state;

import ca.gc.cra.helios.application.port.ClockPort;
import ca.gc.cra.helios.application.port.StateStorePort;
import ca.gc.cra.helios.domain.state.FailureCounter;
import ca.gc.cra.helios.domain.state.PipelineState;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Persists {@link PipelineState} as a small JSON document.
 * <p><strong>Format:</strong> {@code {"version":1,"cursor":"2024-01-01T00:00:00Z","failureCount":0,
 * "updatedAt":"..."}}. Unknown fields are ignored.</p>
 * <p><strong>Recovery:</strong> A missing file, unparseable content, an unsupported version, or a missing cursor all
 * yield {@link Optional#empty()} with a log entry; they never throw. A negative failure count is read as zero.</p>
 * <p><strong>Durability:</strong> Writes go to a sibling temporary file that is then moved over the target, atomically
 * where the filesystem allows it.</p>
 *
 * @since 0.1.0
 */
public final class JsonStateStore implements StateStorePort {
  private static final Logger log = LoggerFactory.getLogger(JsonStateStore.class);

  private final JsonFactory factory = new JsonFactory();
  private final Path file;
  private final ClockPort clock;

  /**
   * Creates a store.
   *
   * @param file state file location
   * @param clock clock used for the {@code updatedAt} field
   */
  public JsonStateStore(Path file, ClockPort clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
  }

  public Path file() {
    return file;
  }

  @Override
  public Optional<PipelineState> load() {
    byte[] content;
    try {
      content = Files.readAllBytes(file);
    } catch (NoSuchFileException ex) {
      log.info("No state file at {}; starting from configured defaults", file);
      return Optional.empty();
    } catch (IOException ex) {
      log.warn("Unable to read state file {}; starting from configured defaults", file, ex);
      return Optional.empty();
    }
    try {
      return Optional.of(parse(content));
    } catch (IOException | IllegalArgumentException | DateTimeException ex) {
      log.warn("State file {} is unusable ({}); starting from configured defaults", file, ex.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void save(PipelineState state) throws IOException {
    Objects.requireNonNull(state, "state");
    Path absolute = file.toAbsolutePath();
    Path dir = absolute.getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }
    Path temp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator generator = factory.createGenerator(out, JsonEncoding.UTF8)) {
        generator.useDefaultPrettyPrinter();
        generator.writeStartObject();
        generator.writeNumberField("version", state.version());
        generator.writeStringField("cursor", state.cursor().toString());
        generator.writeNumberField("failureCount", state.failures().value());
        generator.writeStringField("updatedAt", Instant.ofEpochMilli(clock.nowMillis()).toString());
        generator.writeEndObject();
      }
      move(temp, absolute);
      log.debug("Persisted state cursor={} failureCount={}", state.cursor(), state.failures().value());
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private PipelineState parse(byte[] content) throws IOException {
    Integer version = null;
    Instant cursor = null;
    int failureCount = 0;
    try (JsonParser parser = factory.createParser(content)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("state is not a JSON object");
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "version" -> version = requireInt(parser, value, field);
          case "cursor" -> {
            if (value != JsonToken.VALUE_STRING) {
              throw new IllegalArgumentException("cursor must be a string");
            }
            cursor = Instant.parse(parser.getText());
          }
          case "failureCount" -> failureCount = requireInt(parser, value, field);
          default -> parser.skipChildren();
        }
      }
    }
    if (version == null || version != PipelineState.CURRENT_VERSION) {
      throw new IllegalArgumentException("unsupported state version " + version);
    }
    if (cursor == null) {
      throw new IllegalArgumentException("cursor missing");
    }
    return new PipelineState(version, cursor, new FailureCounter(failureCount));
  }

  private static int requireInt(JsonParser parser, JsonToken token, String field) throws IOException {
    if (token != JsonToken.VALUE_NUMBER_INT) {
      throw new IllegalArgumentException(field + " must be an integer");
    }
    return parser.getIntValue();
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing non-atomically", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
