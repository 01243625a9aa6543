package ca.gc.cra.helios.infrastructure.fs;

import ca.gc.cra.helios.application.port.FileMatcherPort;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands globs against the local filesystem.
 *
 * <p>The longest leading run of path segments without glob characters is used as the walk root, and the walk is
 * limited to the number of remaining segments, so a pattern such as {@code /data/2024/01/*.fits} only lists one
 * directory. Entries that vanish or cannot be read during the walk are logged and skipped.</p>
 *
 * @since 0.1.0
 */
public final class GlobFileMatcher implements FileMatcherPort {
  private static final Logger log = LoggerFactory.getLogger(GlobFileMatcher.class);

  private final FileSystem fileSystem;

  public GlobFileMatcher() {
    this(FileSystems.getDefault());
  }

  GlobFileMatcher(FileSystem fileSystem) {
    this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
  }

  @Override
  public List<Path> match(String glob) throws IOException {
    Objects.requireNonNull(glob, "glob");
    String pattern = glob.replace('\\', '/');
    String[] segments = pattern.split("/", -1);
    int literalCount = 0;
    while (literalCount < segments.length && !hasGlobCharacters(segments[literalCount])) {
      literalCount++;
    }
    if (literalCount == segments.length) {
      Path exact = fileSystem.getPath(glob);
      return Files.isRegularFile(exact) ? List.of(exact) : List.of();
    }

    Path base = basePath(pattern.startsWith("/"), segments, literalCount);
    if (!Files.isDirectory(base)) {
      return List.of();
    }
    int depth = segments.length - literalCount;
    String remainder = String.join("/", Arrays.copyOfRange(segments, literalCount, segments.length));
    PathMatcher matcher = fileSystem.getPathMatcher("glob:" + remainder);
    MatchCollector collector = new MatchCollector(base, depth, matcher);
    Files.walkFileTree(base, EnumSet.noneOf(FileVisitOption.class), depth, collector);
    List<Path> matches = collector.matches();
    matches.sort(Comparator.comparing(Path::toString));
    return List.copyOf(matches);
  }

  private Path basePath(boolean absolute, String[] segments, int literalCount) {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < literalCount; i++) {
      if (!segments[i].isEmpty()) {
        parts.add(segments[i]);
      }
    }
    String joined = String.join("/", parts);
    if (absolute) {
      return fileSystem.getPath("/" + joined);
    }
    return joined.isEmpty() ? fileSystem.getPath(".") : fileSystem.getPath(joined);
  }

  /** Collects matching files; entries that cannot be read are logged and skipped. */
  static final class MatchCollector extends SimpleFileVisitor<Path> {
    private final Path base;
    private final int depth;
    private final PathMatcher matcher;
    private final List<Path> matches = new ArrayList<>();

    MatchCollector(Path base, int depth, PathMatcher matcher) {
      this.base = base;
      this.depth = depth;
      this.matcher = matcher;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      Path relative = base.relativize(file);
      if (relative.getNameCount() == depth && Files.isRegularFile(file) && matcher.matches(relative)) {
        matches.add(file);
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      log.warn("Skipping unreadable entry {} while listing {}: {}", file, base, exc.toString());
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
      if (exc != null) {
        log.warn("Listing of {} stopped early: {}", dir, exc.toString());
      }
      return FileVisitResult.CONTINUE;
    }

    List<Path> matches() {
      return matches;
    }
  }

  private static boolean hasGlobCharacters(String segment) {
    for (int i = 0; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (c == '*' || c == '?' || c == '[' || c == '{') {
        return true;
      }
    }
    return false;
  }
}
