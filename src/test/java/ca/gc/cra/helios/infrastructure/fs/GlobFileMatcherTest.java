package ca.gc.cra.helios.infrastructure.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class GlobFileMatcherTest {
  @TempDir Path tempDir;

  private final GlobFileMatcher matcher = new GlobFileMatcher();

  @BeforeEach
  void setUp() throws IOException {
    Path day = Files.createDirectories(tempDir.resolve("2024/01/01"));
    Files.writeString(day.resolve("img_0171_b.fits"), "");
    Files.writeString(day.resolve("img_0171_a.fits"), "");
    Files.writeString(day.resolve("img_0193_a.fits"), "");
    Files.createDirectories(day.resolve("img_0171_dir.fits"));
  }

  @Test
  void matchesWildcardInLastSegmentSorted() throws IOException {
    List<Path> matches = matcher.match(tempDir + "/2024/01/01/img_0171_*.fits");

    assertEquals(
        List.of(tempDir.resolve("2024/01/01/img_0171_a.fits"), tempDir.resolve("2024/01/01/img_0171_b.fits")),
        matches);
  }

  @Test
  void matchesWildcardsInDirectorySegments() throws IOException {
    List<Path> matches = matcher.match(tempDir + "/2024/*/0?/img_0193_*.fits");

    assertEquals(List.of(tempDir.resolve("2024/01/01/img_0193_a.fits")), matches);
  }

  @Test
  void literalPathMatchesOnlyExistingFile() throws IOException {
    assertEquals(1, matcher.match(tempDir + "/2024/01/01/img_0171_a.fits").size());
    assertTrue(matcher.match(tempDir + "/2024/01/01/img_9999.fits").isEmpty());
  }

  @Test
  void entryThatCannotBeReadIsLoggedAndSkipped() {
    Logger matcherLogger = (Logger) LoggerFactory.getLogger(GlobFileMatcher.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    matcherLogger.addAppender(appender);
    try {
      GlobFileMatcher.MatchCollector collector = new GlobFileMatcher.MatchCollector(
          tempDir, 1, FileSystems.getDefault().getPathMatcher("glob:*.fits"));
      Path gone = tempDir.resolve("gone.fits");

      FileVisitResult result = collector.visitFileFailed(gone, new NoSuchFileException(gone.toString()));

      assertEquals(FileVisitResult.CONTINUE, result);
      assertTrue(collector.matches().isEmpty());
      assertEquals(Level.WARN, appender.list.get(0).getLevel());
      assertTrue(appender.list.get(0).getFormattedMessage().contains("gone.fits"));
    } finally {
      matcherLogger.detachAppender(appender);
    }
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void unreadableDirectoryDoesNotHideOtherMatches() throws IOException {
    Path locked = Files.createDirectories(tempDir.resolve("2024/01/02"));
    Files.writeString(locked.resolve("img_0193_a.fits"), "");
    Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
    try {
      assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

      List<Path> matches = matcher.match(tempDir + "/2024/01/*/img_0193_*.fits");

      assertEquals(List.of(tempDir.resolve("2024/01/01/img_0193_a.fits")), matches);
    } finally {
      Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
    }
  }

  @Test
  void missingBaseDirectoryYieldsEmpty() throws IOException {
    assertTrue(matcher.match(tempDir + "/2023/*/img_*.fits").isEmpty());
  }
}
