package com.github.lukaszbudnik.logroll;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RotatingLogHandleTest {

  private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

  @TempDir Path tempDir;

  private MutableClock clock;
  private RotationMetrics metrics;
  private Path logFile;
  private JournalArchiveRecordStore recordStore;
  private ArchiveManager archiveManager;
  private final List<RotatingLogHandle> handles = new ArrayList<>();

  @BeforeEach
  void setUp() throws Exception {
    clock = new MutableClock(START, ZoneOffset.UTC);
    metrics = new RotationMetrics();
    logFile = tempDir.resolve("logs").resolve("app.log");
    recordStore = new JournalArchiveRecordStore(tempDir.resolve("metadata"));
    archiveManager = new ArchiveManager(recordStore, metrics, clock, Duration.ofSeconds(10));
  }

  @AfterEach
  void tearDown() throws Exception {
    for (RotatingLogHandle handle : handles) {
      handle.close();
    }
    archiveManager.close();
    recordStore.close();
  }

  private RotatingLogHandle open(RotationPolicy policy) throws IOException {
    RotatingLogHandle handle =
        new RotatingLogHandle(logFile, policy, archiveManager, metrics, clock);
    handles.add(handle);
    return handle;
  }

  private RotatingLogHandle open(RotationPolicy policy, FileDeleter deleter, FileRenamer renamer)
      throws IOException {
    RotatingLogHandle handle =
        new RotatingLogHandle(logFile, policy, archiveManager, metrics, clock, deleter, renamer);
    handles.add(handle);
    return handle;
  }

  private Path rotatedFile(String name, Instant modified) throws IOException {
    Path path = logFile.resolveSibling(name);
    Files.writeString(path, name);
    Files.setLastModifiedTime(path, FileTime.from(modified));
    return path;
  }

  private static List<Path> fileNames(List<Path> paths) {
    List<Path> names = new ArrayList<>();
    for (Path path : paths) {
      names.add(path.getFileName());
    }
    return names;
  }

  private static String gunzip(Path file) throws IOException {
    try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static String repeat(char c, int count) {
    return String.valueOf(c).repeat(count);
  }

  @Test
  void shouldRolloverExactlyAtMaxSize() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(RotationPolicy.builder("size").maxSizeBytes(1000L).compressionEnabled(false).build());

    // When
    handle.write(repeat('a', 999));

    // Then
    assertFalse(handle.shouldRollover(), "999 bytes should not trigger rotation");

    handle.write("a");
    assertTrue(handle.shouldRollover(), "1000 bytes should trigger rotation");
  }

  @Test
  void shouldRolloverAfterMaxAgeAndResetTimer() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(RotationPolicy.builder("age").maxAge(Duration.ofHours(1)).build());
    handle.write("line\n");

    // When / Then
    clock.advance(Duration.ofMinutes(59));
    assertFalse(handle.shouldRollover());

    clock.advance(Duration.ofMinutes(1));
    assertTrue(handle.shouldRollover());
    assertTrue(handle.rolloverIfNeeded());

    assertEquals(clock.instant(), handle.getLastRolloverTime());
    assertFalse(handle.shouldRollover(), "Rotation should reset the age timer");
    assertFalse(handle.rolloverIfNeeded());
  }

  @Test
  void shouldRolloverWhenFreeSpaceIsLow() throws Exception {
    RotatingLogHandle handle =
        open(RotationPolicy.builder("disk").minFreeSpaceBytes(Long.MAX_VALUE).build());

    assertTrue(handle.shouldRollover());
  }

  @Test
  void shouldNotRolloverWithoutTriggers() throws Exception {
    RotatingLogHandle handle = open(RotationPolicy.builder("manual").build());
    handle.write(repeat('x', 10_000));
    clock.advance(Duration.ofDays(365));

    assertFalse(handle.shouldRollover());
  }

  @Test
  void shouldRotateAndCompressPreservingContent() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(RotationPolicy.builder("gzip").maxSizeBytes(1000L).compressionLevel(9).build());
    handle.write("line1\nline2\n");

    // When
    RotationResult result = handle.doRollover();

    // Then
    assertTrue(result.isRotated());
    Path rotated = result.getRotatedFile();
    assertEquals("app.log.20260101000000.gz", rotated.getFileName().toString());
    assertEquals("line1\nline2\n", gunzip(rotated));
    assertFalse(Files.exists(logFile.resolveSibling("app.log.20260101000000")));
    assertTrue(Files.exists(logFile));
    assertEquals(0, Files.size(logFile));
    assertEquals(Boolean.FALSE, result.getArchival().block());

    assertEquals(1, metrics.getRotations("gzip", RotationMetrics.OUTCOME_START));
    assertEquals(1, metrics.getRotations("gzip", RotationMetrics.OUTCOME_SUCCESS));
    assertEquals(0, metrics.getRotations("gzip", RotationMetrics.OUTCOME_FAILURE));
    assertEquals(1, metrics.getCompressions());
  }

  @Test
  void shouldKeepWritingToFreshFileAfterRotation() throws Exception {
    RotatingLogHandle handle =
        open(RotationPolicy.builder("plain").maxSizeBytes(100L).compressionEnabled(false).build());

    handle.write(repeat('a', 100));
    handle.write("next\n");

    List<Path> artifacts = handle.rotatedArtifacts();
    assertEquals(1, artifacts.size(), "Write past the limit should rotate first");
    assertEquals(repeat('a', 100), Files.readString(artifacts.get(0)));
    assertEquals("next\n", Files.readString(logFile));
  }

  @Test
  void shouldKeepAtMostMaxFilesNewestFirst() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(RotationPolicy.builder("bounded").maxSizeBytes(1000L).maxFiles(3).build());

    // When
    for (int i = 0; i < 5; i++) {
      handle.write("entry " + i + "\n");
      handle.doRollover();
      clock.advance(Duration.ofSeconds(1));
      assertTrue(handle.rotatedArtifacts().size() <= 3);
    }

    // Then
    List<Path> artifacts = handle.rotatedArtifacts();
    assertEquals(3, artifacts.size());
    assertEquals("app.log.20260101000004.gz", artifacts.get(0).getFileName().toString());
    assertEquals("app.log.20260101000003.gz", artifacts.get(1).getFileName().toString());
    assertEquals("app.log.20260101000002.gz", artifacts.get(2).getFileName().toString());
    assertEquals("entry 4\n", gunzip(artifacts.get(0)));
  }

  @Test
  void shouldAppendCounterWhenRotatedNameIsTaken() throws Exception {
    RotatingLogHandle handle = open(RotationPolicy.builder("fast").maxSizeBytes(1000L).build());

    handle.write("first\n");
    Path first = handle.doRollover().getRotatedFile();
    handle.write("second\n");
    Path second = handle.doRollover().getRotatedFile();

    assertEquals("app.log.20260101000000.gz", first.getFileName().toString());
    assertEquals("app.log.20260101000000.1.gz", second.getFileName().toString());
    assertEquals("first\n", gunzip(first));
    assertEquals("second\n", gunzip(second));
  }

  @Test
  void shouldRotateNothingWhenActiveFileIsEmpty() throws Exception {
    // Given
    RotatingLogHandle handle = open(RotationPolicy.builder("empty").maxSizeBytes(1000L).build());
    clock.advance(Duration.ofHours(2));

    // When
    RotationResult result = handle.doRollover();

    // Then
    assertFalse(result.isRotated());
    assertNull(result.getRotatedFile());
    assertEquals(Boolean.FALSE, result.getArchival().block());
    assertTrue(handle.rotatedArtifacts().isEmpty());
    assertEquals(clock.instant(), handle.getLastRolloverTime());
    assertTrue(Files.exists(logFile));
  }

  @Test
  void shouldRecreateDeletedActiveFile() throws Exception {
    RotatingLogHandle handle = open(RotationPolicy.builder("gone").maxSizeBytes(1000L).build());
    Files.delete(logFile);

    RotationResult result = handle.doRollover();

    assertFalse(result.isRotated());
    assertTrue(Files.exists(logFile));
    handle.write("after\n");
    assertEquals("after\n", Files.readString(logFile));
  }

  @Test
  void shouldArchiveRotatedFileToLocalBackend() throws Exception {
    // Given
    Path archiveDir = tempDir.resolve("archive");
    archiveManager.registerBackend("local", new LocalStorageBackend(archiveDir));
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("archived")
                .maxSizeBytes(1000L)
                .maxFiles(3)
                .archiveBackendName("local")
                .build());
    handle.write(repeat('z', 1200));
    assertTrue(handle.shouldRollover());

    // When
    RotationResult result = handle.doRollover();

    // Then
    assertEquals(Boolean.TRUE, result.getArchival().block(Duration.ofSeconds(10)));
    Path rotated = result.getRotatedFile();
    assertTrue(rotated.getFileName().toString().endsWith(".gz"));
    assertTrue(Files.exists(rotated), "Rotated file is kept locally by default");
    assertTrue(Files.exists(archiveDir.resolve(rotated.getFileName())));
    assertEquals(1, recordStore.size());
    ArchiveRecord record =
        recordStore.findBySourceFileName(rotated.getFileName().toString()).get(0);
    assertEquals("local", record.getBackendName());
    assertEquals(ArchiveManager.calculateFileHash(rotated), record.getContentHash());
    assertEquals(0, Files.size(logFile));
    assertEquals(repeat('z', 1200), gunzip(rotated));
  }

  @Test
  void shouldKeepRotatedFileWhenArchivalFails() throws Exception {
    // Given
    archiveManager.registerBackend("broken", (file, hash) -> false);
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("failing")
                .maxSizeBytes(1000L)
                .archiveBackendName("broken")
                .deleteAfterArchive(true)
                .build());
    handle.write("important\n");

    // When
    RotationResult result = handle.doRollover();

    // Then
    assertEquals(Boolean.FALSE, result.getArchival().block(Duration.ofSeconds(10)));
    assertTrue(Files.exists(result.getRotatedFile()));
    assertEquals("important\n", gunzip(result.getRotatedFile()));
    assertEquals(0, recordStore.size());
    assertEquals(1, metrics.getRotations("failing", RotationMetrics.OUTCOME_SUCCESS));
  }

  @Test
  void shouldNotWarnAgainWhenBackendRejectsUpload() throws Exception {
    // Given
    archiveManager.registerBackend("rejecting", (file, hash) -> false);
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("rejected")
                .maxSizeBytes(1000L)
                .archiveBackendName("rejecting")
                .build());
    handle.write("data\n");
    Logger handleLogger = (Logger) LoggerFactory.getLogger(RotatingLogHandle.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    handleLogger.addAppender(appender);

    // When
    try {
      assertEquals(
          Boolean.FALSE, handle.doRollover().getArchival().block(Duration.ofSeconds(10)));
    } finally {
      handleLogger.detachAppender(appender);
    }

    // Then
    for (ILoggingEvent event : appender.list) {
      assertFalse(
          event.getLevel().isGreaterOrEqual(Level.WARN), "Unexpected: " + event.getMessage());
    }
  }

  @Test
  void shouldDeleteArchivedFileWhenConfigured() throws Exception {
    archiveManager.registerBackend("local", new LocalStorageBackend(tempDir.resolve("archive")));
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("move")
                .maxSizeBytes(1000L)
                .archiveBackendName("local")
                .deleteAfterArchive(true)
                .build());
    handle.write("moved\n");

    RotationResult result = handle.doRollover();

    assertEquals(Boolean.TRUE, result.getArchival().block(Duration.ofSeconds(10)));
    assertFalse(Files.exists(result.getRotatedFile()));
    Path archived = tempDir.resolve("archive").resolve(result.getRotatedFile().getFileName());
    assertTrue(Files.exists(archived));
    assertEquals(1, recordStore.size());
  }

  @Test
  void shouldCompressLeftoverRotatedFiles() throws Exception {
    // Given
    RotatingLogHandle handle = open(RotationPolicy.builder("leftover").maxSizeBytes(1000L).build());
    Path leftover = logFile.resolveSibling("app.log.20251231000000");
    Files.writeString(leftover, "crashed before compression\n");
    Path unrelated = logFile.resolveSibling("app.log.bak");
    Files.writeString(unrelated, "not a rotated file\n");

    // When
    int compressed = handle.compressOldFiles();

    // Then
    assertEquals(1, compressed);
    assertFalse(Files.exists(leftover));
    assertEquals(
        "crashed before compression\n",
        gunzip(logFile.resolveSibling("app.log.20251231000000.gz")));
    assertTrue(Files.exists(unrelated));
    assertEquals(0, handle.compressOldFiles(), "Already compressed files are left alone");
  }

  @Test
  void shouldNotCompressWhenCompressionDisabled() throws Exception {
    RotatingLogHandle handle =
        open(RotationPolicy.builder("raw").maxSizeBytes(1000L).compressionEnabled(false).build());
    handle.write("raw\n");

    Path rotated = handle.doRollover().getRotatedFile();

    assertEquals("app.log.20260101000000", rotated.getFileName().toString());
    assertEquals("raw\n", Files.readString(rotated));
    assertEquals(0, handle.compressOldFiles());
    assertEquals(0, metrics.getCompressions());
  }

  @Test
  void shouldPruneOnlyRotatedArtifactsOfThisLog() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(RotationPolicy.builder("prune").maxSizeBytes(1000L).maxFiles(0).build());
    Path otherLog = logFile.resolveSibling("other.log.20260101000000.gz");
    Files.writeString(otherLog, "other");
    handle.write("gone\n");

    // When
    RotationResult result = handle.doRollover();

    // Then
    assertFalse(Files.exists(result.getRotatedFile()), "max_files 0 keeps no rotated files");
    assertTrue(Files.exists(otherLog));
    assertTrue(Files.exists(logFile));
  }

  @Test
  void shouldRejectWritesAfterClose() throws Exception {
    RotatingLogHandle handle = open(RotationPolicy.builder("closed").build());
    handle.close();

    assertThrows(IOException.class, () -> handle.write("late\n"));
  }

  @Test
  void shouldRequireArchiveManagerWhenPolicyArchives() {
    RotationPolicy policy = RotationPolicy.builder("archived").archiveBackendName("s3").build();

    assertThrows(
        IllegalArgumentException.class,
        () -> new RotatingLogHandle(logFile, policy, null, metrics, clock));
  }

  @Test
  void shouldFailArchivalOfUnknownBackendWithoutFailingRotation() throws Exception {
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("typo")
                .maxSizeBytes(1000L)
                .archiveBackendName("does-not-exist")
                .build());
    handle.write("data\n");

    RotationResult result = handle.doRollover();

    assertTrue(result.isRotated());
    assertEquals(Boolean.FALSE, result.getArchival().block());
    assertEquals(1, metrics.getRotations("typo", RotationMetrics.OUTCOME_SUCCESS));
  }

  @Test
  void shouldKeepModificationTimeOfLeftoverWhenCompressingIt() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(RotationPolicy.builder("leftover-age").maxSizeBytes(1000L).maxFiles(2).build());
    Instant now = Instant.now();
    Path leftover = rotatedFile("app.log.20200101000000", now.minus(Duration.ofDays(10)));
    Path recent = rotatedFile("app.log.20200105000000.gz", now.minus(Duration.ofDays(1)));

    // When
    handle.runMaintenance();
    handle.write("fresh\n");
    Path rotated = handle.doRollover().getRotatedFile();

    // Then
    Path compressedLeftover = leftover.resolveSibling("app.log.20200101000000.gz");
    assertFalse(Files.exists(leftover));
    assertFalse(Files.exists(compressedLeftover), "Oldest artifact is pruned past max_files");
    assertTrue(Files.exists(recent));
    assertTrue(Files.exists(rotated));
    assertEquals(
        List.of(rotated.getFileName(), recent.getFileName()), fileNames(handle.rotatedArtifacts()));
  }

  @Test
  void shouldOrderArtifactsWithEqualModificationTimeByNameTimestampAndCounter()
      throws Exception {
    // Given
    RotatingLogHandle handle = open(RotationPolicy.builder("ties").maxFiles(10).build());
    Instant modified = Instant.now().minus(Duration.ofHours(1));
    Path base = rotatedFile("app.log.20260101000000.gz", modified);
    Path first = rotatedFile("app.log.20260101000000.1.gz", modified);
    Path ninth = rotatedFile("app.log.20260101000000.9.gz", modified);
    Path tenth = rotatedFile("app.log.20260101000000.10.gz", modified);
    Path later = rotatedFile("app.log.20260101000001", modified);

    // When
    List<Path> artifacts = fileNames(handle.rotatedArtifacts());

    // Then
    assertEquals(
        List.of(
            later.getFileName(),
            tenth.getFileName(),
            ninth.getFileName(),
            first.getFileName(),
            base.getFileName()),
        artifacts);
  }

  @Test
  void shouldKeepActiveContentWhenRenameFails() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("stuck").maxSizeBytes(1000L).build(),
            FileDeleter.defaultDeleter(),
            (source, target) -> {
              throw new IOException("device busy");
            });
    handle.write("before\n");
    Instant lastRollover = handle.getLastRolloverTime();
    clock.advance(Duration.ofMinutes(5));

    // When
    RotationException exception = assertThrows(RotationException.class, handle::doRollover);

    // Then
    assertEquals("device busy", exception.getCause().getMessage());
    assertEquals(lastRollover, handle.getLastRolloverTime());
    assertTrue(handle.rotatedArtifacts().isEmpty());
    handle.write("after\n");
    assertEquals("before\nafter\n", Files.readString(logFile));
    assertEquals(1, metrics.getRotations("stuck", RotationMetrics.OUTCOME_FAILURE));
    assertEquals(0, metrics.getRotations("stuck", RotationMetrics.OUTCOME_SUCCESS));
  }

  @Test
  void shouldKeepRawRotatedFileWhenCompressionFails() throws Exception {
    // Given
    RotatingLogHandle handle =
        open(
            RotationPolicy.builder("no-delete").maxSizeBytes(1000L).build(),
            path -> {
              throw new IOException("read-only directory");
            },
            FileRenamer.defaultRenamer());
    handle.write("keep me\n");

    // When
    assertThrows(CompressionException.class, handle::doRollover);

    // Then
    Path raw = logFile.resolveSibling("app.log.20260101000000");
    assertEquals("keep me\n", Files.readString(raw));
    assertFalse(Files.exists(raw.resolveSibling("app.log.20260101000000.gz")));
    assertEquals(1, metrics.getRotations("no-delete", RotationMetrics.OUTCOME_FAILURE));
    assertEquals(0, metrics.getRotations("no-delete", RotationMetrics.OUTCOME_SUCCESS));
    assertEquals(0, metrics.getCompressions());
    assertEquals(0, Files.size(logFile));
    handle.write("next\n");
    assertEquals("next\n", Files.readString(logFile));
  }
}
