package ca.gc.cra.helios.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Expands a filesystem glob to matching files.
 *
 * @since 0.1.0
 */
public interface FileMatcherPort {
  /**
   * Lists regular files matching a glob.
   *
   * @param glob glob pattern (may contain {@code *}, {@code ?}, {@code [..]}, and {@code {a,b}})
   * @return matches in ascending lexicographic path order; empty when nothing matches
   * @throws IOException if a directory cannot be walked
   */
  List<Path> match(String glob) throws IOException;
}
