package ca.gc.cra.helios.application.pipeline;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/** Resolves program names the way a shell would, for startup sanity checks. */
final class Executables {
  private Executables() {}

  static boolean isRunnable(String executable) {
    try {
      if (executable.contains("/") || executable.contains(File.separator)) {
        Path path = Path.of(executable);
        return Files.isRegularFile(path) && Files.isExecutable(path);
      }
      String searchPath = System.getenv("PATH");
      if (searchPath == null) {
        return false;
      }
      for (String dir : searchPath.split(File.pathSeparator)) {
        if (dir.isEmpty()) {
          continue;
        }
        Path candidate = Path.of(dir, executable);
        if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
          return true;
        }
      }
      return false;
    } catch (InvalidPathException ex) {
      return false;
    }
  }
}
