package ca.gc.cra.helios.support;

import ca.gc.cra.helios.application.port.FileMatcherPort;
import ca.gc.cra.helios.application.port.QualityReaderPort;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

/** In-memory file system view: glob patterns map to paths and paths map to quality values. */
public final class StubFiles implements FileMatcherPort, QualityReaderPort {
  private final Map<String, List<Path>> matches = new HashMap<>();
  private final Map<Path, Long> quality = new HashMap<>();
  private final Map<Path, IOException> failures = new HashMap<>();
  private final Map<String, RuntimeException> listingFailures = new HashMap<>();
  private final AtomicInteger matchCalls = new AtomicInteger();

  public synchronized StubFiles file(String glob, String path, long qualityValue) {
    Path file = Path.of(path);
    matches.computeIfAbsent(glob, k -> new ArrayList<>()).add(file);
    quality.put(file, qualityValue);
    return this;
  }

  public synchronized StubFiles fileWithoutKeyword(String glob, String path) {
    matches.computeIfAbsent(glob, k -> new ArrayList<>()).add(Path.of(path));
    return this;
  }

  public synchronized StubFiles unreadable(String glob, String path) {
    Path file = Path.of(path);
    matches.computeIfAbsent(glob, k -> new ArrayList<>()).add(file);
    failures.put(file, new IOException("corrupt header"));
    return this;
  }

  public synchronized StubFiles failListing(String glob, RuntimeException failure) {
    listingFailures.put(glob, failure);
    return this;
  }

  @Override
  public synchronized List<Path> match(String glob) {
    matchCalls.incrementAndGet();
    RuntimeException failure = listingFailures.get(glob);
    if (failure != null) {
      throw failure;
    }
    return List.copyOf(matches.getOrDefault(glob, List.of()));
  }

  @Override
  public synchronized OptionalLong readQuality(Path file) throws IOException {
    IOException failure = failures.get(file);
    if (failure != null) {
      throw failure;
    }
    Long value = quality.get(file);
    return value == null ? OptionalLong.empty() : OptionalLong.of(value);
  }

  public int matchCalls() {
    return matchCalls.get();
  }
}
