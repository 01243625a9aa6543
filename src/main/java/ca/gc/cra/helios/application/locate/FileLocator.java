package ca.gc.cra.helios.application.locate;

import ca.gc.cra.helios.application.port.FileMatcherPort;
import ca.gc.cra.helios.application.port.MetricsPort;
import ca.gc.cra.helios.application.port.QualityReaderPort;
import ca.gc.cra.helios.domain.locate.Candidate;
import ca.gc.cra.helios.domain.locate.LocatorKey;
import ca.gc.cra.helios.domain.locate.PathTemplate;
import ca.gc.cra.helios.domain.quality.QualityGate;
import ca.gc.cra.helios.domain.quality.QualityMask;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves a {@link LocatorKey} to the first image on disk that passes the quality gate.
 * <p><strong>Why:</strong> Several captures may exist for one nominal time; the pipeline needs exactly one usable
 * image per channel, and repeated lookups within a run must agree.</p>
 * <p><strong>Role:</strong> Application service used by pipeline steps and the {@code locate} command.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Expand the configured path template and list matches in ascending path order.</li>
 *   <li>Read each candidate's quality header and return the first good one.</li>
 *   <li>Memoize results per key, including negative results, for the locator's lifetime.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent lookups. Two threads racing on the same uncached key may both
 * scan the disk; the first stored result wins and both return it.</p>
 * <p><strong>Observability:</strong> Emits {@code locator.cache.hit}, {@code locator.file.rejected}, and
 * {@code locator.file.missing}.</p>
 *
 * @since 0.1.0
 */
public final class FileLocator {
  private static final Logger log = LoggerFactory.getLogger(FileLocator.class);

  private final PathTemplate template;
  private final QualityGate gate;
  private final FileMatcherPort matcher;
  private final QualityReaderPort reader;
  private final MetricsPort metrics;
  private final ConcurrentMap<LocatorKey, Optional<Path>> cache = new ConcurrentHashMap<>();

  /**
   * Creates a locator.
   *
   * @param template path template expanded per key
   * @param gate quality gate applied to candidates
   * @param matcher glob expansion port
   * @param reader header reader port
   * @param metrics metrics sink
   */
  public FileLocator(
      PathTemplate template,
      QualityGate gate,
      FileMatcherPort matcher,
      QualityReaderPort reader,
      MetricsPort metrics) {
    this.template = Objects.requireNonNull(template, "template");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Returns the first good image for a key, consulting the cache first.
   *
   * @param key lookup key
   * @return path of the chosen image, or empty when no candidate passes the gate
   */
  public Optional<Path> locate(LocatorKey key) {
    Objects.requireNonNull(key, "key");
    Optional<Path> cached = cache.get(key);
    if (cached != null) {
      metrics.increment("locator.cache.hit");
      return cached;
    }
    Optional<Path> found = scan(key);
    Optional<Path> previous = cache.putIfAbsent(key, found);
    return previous != null ? previous : found;
  }

  /**
   * Resolves several keys, spreading uncached lookups across an executor.
   *
   * @param keys keys to resolve, in the order results should be reported
   * @param executor worker pool; the caller owns its lifecycle
   * @return ordered map from key to its resolution
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public Map<LocatorKey, Optional<Path>> locateAll(List<LocatorKey> keys, ExecutorService executor)
      throws InterruptedException {
    Objects.requireNonNull(keys, "keys");
    Objects.requireNonNull(executor, "executor");
    Map<LocatorKey, Future<Optional<Path>>> pending = new LinkedHashMap<>();
    for (LocatorKey key : keys) {
      pending.computeIfAbsent(key, k -> executor.submit(() -> locate(k)));
    }
    Map<LocatorKey, Optional<Path>> results = new LinkedHashMap<>();
    try {
      for (Map.Entry<LocatorKey, Future<Optional<Path>>> entry : pending.entrySet()) {
        results.put(entry.getKey(), entry.getValue().get());
      }
    } catch (InterruptedException ex) {
      pending.values().forEach(future -> future.cancel(true));
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("lookup failed", cause);
    }
    return results;
  }

  /**
   * Lists every candidate for a key together with its quality mask, without consulting or filling the cache.
   *
   * <p>Candidates without a readable quality value are omitted.</p>
   *
   * @param key lookup key
   * @return candidates in ascending path order
   */
  public List<Candidate> candidates(LocatorKey key) {
    List<Candidate> candidates = new ArrayList<>();
    for (Path path : listMatches(key)) {
      readMask(path).ifPresent(mask -> candidates.add(new Candidate(path, mask)));
    }
    return List.copyOf(candidates);
  }

  /**
   * Returns the template this locator expands.
   *
   * @return path template
   */
  public PathTemplate template() {
    return template;
  }

  int cacheSize() {
    return cache.size();
  }

  private Optional<Path> scan(LocatorKey key) {
    for (Path path : listMatches(key)) {
      Optional<QualityMask> mask = readMask(path);
      if (mask.isEmpty()) {
        metrics.increment("locator.file.rejected");
        continue;
      }
      if (gate.isGood(mask.get())) {
        log.debug("Selected {} for {} (quality {})", path, key, mask.get());
        return Optional.of(path);
      }
      metrics.increment("locator.file.rejected");
      log.info("Rejected {} for {}: {}", path, key, gate.explainRejection(mask.get()));
    }
    metrics.increment("locator.file.missing");
    log.info("No good quality file found for {}", key);
    return Optional.empty();
  }

  private List<Path> listMatches(LocatorKey key) {
    String glob = template.expand(key);
    List<Path> matches;
    try {
      matches = new ArrayList<>(matcher.match(glob));
    } catch (IOException ex) {
      log.warn("Unable to list files for pattern {}", glob, ex);
      return List.of();
    } catch (UncheckedIOException ex) {
      log.warn("Unable to list files for pattern {}", glob, ex.getCause());
      return List.of();
    }
    matches.sort(Comparator.comparing(Path::toString));
    log.debug("Pattern {} matched {} file(s)", glob, matches.size());
    return matches;
  }

  private Optional<QualityMask> readMask(Path path) {
    try {
      OptionalLong raw = reader.readQuality(path);
      if (raw.isEmpty()) {
        log.warn("File {} has no quality keyword; treating as bad quality", path);
        return Optional.empty();
      }
      return Optional.of(QualityMask.fromHeader(raw.getAsLong()));
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Unable to read quality for file {}; treating as bad quality", path, ex);
      return Optional.empty();
    }
  }
}
