package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * A log file rotated according to a {@link RotationPolicy}.
 *
 * <p>Writes go straight to the active file. Before each write the rotation triggers are checked and,
 * if one fires, the file is rolled over: the active file is renamed to {@code
 * {file}.{yyyyMMddHHmmss}} (UTC), a fresh active file is opened, the rotated file is compressed to
 * {@code .gz}, handed to the {@link ArchiveManager} and finally the rotated artifacts beyond {@link
 * RotationPolicy#getMaxFiles()} are pruned, newest kept.
 *
 * <p>Two locks keep this consistent. The write lock guards the active stream and the rename; it is
 * released as soon as the new active file is open, so writers never wait for compression. The
 * maintenance lock serializes whole rotations with {@link #compressOldFiles()} and {@link
 * #pruneOldFiles()}, so a rotation triggered by a write and one triggered by the scheduler can never
 * both fire for the same condition. The maintenance lock is always acquired before the write lock.
 */
public class RotatingLogHandle implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RotatingLogHandle.class);

  static final DateTimeFormatter ROTATION_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
  static final String COMPRESSED_SUFFIX = ".gz";

  private final Path file;
  private final RotationPolicy policy;
  private final ArchiveManager archiveManager;
  private final RotationMetrics metrics;
  private final Clock clock;
  private final FileDeleter deleter;
  private final FileRenamer renamer;
  private final Pattern artifactPattern;

  private final ReentrantLock lock = new ReentrantLock();
  private final ReentrantLock maintenanceLock = new ReentrantLock();

  private volatile Instant lastRolloverTime;
  private OutputStream stream;
  private boolean closed;

  public RotatingLogHandle(Path file, RotationPolicy policy) throws IOException {
    this(file, policy, null, new RotationMetrics(), Clock.systemUTC());
  }

  public RotatingLogHandle(
      Path file,
      RotationPolicy policy,
      ArchiveManager archiveManager,
      RotationMetrics metrics,
      Clock clock)
      throws IOException {
    this(
        file,
        policy,
        archiveManager,
        metrics,
        clock,
        FileDeleter.defaultDeleter(),
        FileRenamer.defaultRenamer());
  }

  RotatingLogHandle(
      Path file,
      RotationPolicy policy,
      ArchiveManager archiveManager,
      RotationMetrics metrics,
      Clock clock,
      FileDeleter deleter,
      FileRenamer renamer)
      throws IOException {
    this.file = file.toAbsolutePath().normalize();
    this.policy = Objects.requireNonNull(policy, "policy");
    this.archiveManager = archiveManager;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.deleter = Objects.requireNonNull(deleter, "deleter");
    this.renamer = Objects.requireNonNull(renamer, "renamer");
    if (policy.hasArchiveBackend() && archiveManager == null) {
      throw new IllegalArgumentException(
          "Policy " + policy.getName() + " archives rotated files but no archive manager was given");
    }
    this.artifactPattern =
        Pattern.compile(
            Pattern.quote(this.file.getFileName().toString())
                + "\\.(\\d{14})(?:\\.(\\d{1,9}))?(?:\\.gz)?");
    this.lastRolloverTime = clock.instant();

    Files.createDirectories(this.file.getParent());
    openStream();
    logger.info("Opened rotating log {} with {}", this.file, policy);
  }

  public Path getFile() {
    return file;
  }

  public RotationPolicy getPolicy() {
    return policy;
  }

  public Instant getLastRolloverTime() {
    return lastRolloverTime;
  }

  /**
   * Append bytes to the active file, rolling it over first if a rotation trigger fires.
   *
   * <p>The trigger check is skipped while another rotation or maintenance run holds the handle; the
   * next write or scheduler tick checks again.
   *
   * @param data bytes to append
   * @throws IOException if the handle is closed or the write fails
   * @throws LogRotationException if a triggered rotation fails
   */
  public void write(byte[] data) throws IOException, LogRotationException {
    if (maintenanceLock.tryLock()) {
      try {
        if (shouldRollover()) {
          rotate();
        }
      } finally {
        maintenanceLock.unlock();
      }
    }

    lock.lock();
    try {
      if (closed || stream == null) {
        throw new IOException("Rotating log is closed: " + file);
      }
      stream.write(data);
    } finally {
      lock.unlock();
    }
  }

  /** Append UTF-8 encoded text. See {@link #write(byte[])}. */
  public void write(String text) throws IOException, LogRotationException {
    write(text.getBytes(StandardCharsets.UTF_8));
  }

  public void flush() throws IOException {
    lock.lock();
    try {
      if (stream != null) {
        stream.flush();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Check whether any configured rotation trigger is satisfied.
   *
   * @return true if the size, age or free-space threshold is reached
   */
  public boolean shouldRollover() {
    lock.lock();
    try {
      return (policy.hasSizeTrigger() && sizeLimitReached())
          || (policy.hasAgeTrigger() && ageLimitReached())
          || (policy.hasFreeSpaceTrigger() && freeSpaceLow());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Check the rotation triggers and roll over if one fires, as a single step.
   *
   * @return true if a rotation was performed
   */
  public boolean rolloverIfNeeded() throws RotationException, CompressionException {
    maintenanceLock.lock();
    try {
      if (!shouldRollover()) {
        return false;
      }
      rotate();
      return true;
    } finally {
      maintenanceLock.unlock();
    }
  }

  /**
   * Roll over unconditionally, bypassing the triggers.
   *
   * <p>A missing or empty active file has nothing to rotate: the file is reopened and the rotation
   * time reset, but no artifact is produced.
   *
   * @return the rotation outcome
   * @throws RotationException if the active file cannot be renamed; the active file is left in place
   * @throws CompressionException if the rotated file cannot be compressed; the uncompressed rotated
   *     file is kept
   */
  public RotationResult doRollover() throws RotationException, CompressionException {
    maintenanceLock.lock();
    try {
      return rotate();
    } finally {
      maintenanceLock.unlock();
    }
  }

  private RotationResult rotate() throws RotationException, CompressionException {
    String policyName = policy.getName();
    metrics.recordRotation(policyName, RotationMetrics.OUTCOME_START);

    Path rotated;
    lock.lock();
    try {
      rotated = rotateActiveFile();
    } catch (IOException e) {
      metrics.recordRotation(policyName, RotationMetrics.OUTCOME_FAILURE);
      logger.error("Failed to rotate {}: {}", file, e.getMessage(), e);
      throw new RotationException("Failed to rotate " + file, e);
    } finally {
      lock.unlock();
    }

    if (rotated == null) {
      metrics.recordRotation(policyName, RotationMetrics.OUTCOME_SUCCESS);
      logger.debug("Nothing to rotate for {}", file);
      return RotationResult.nothingRotated();
    }

    Path artifact = rotated;
    if (policy.isCompressionEnabled()) {
      try {
        artifact = compress(rotated);
      } catch (CompressionException e) {
        metrics.recordRotation(policyName, RotationMetrics.OUTCOME_FAILURE);
        throw e;
      }
    }

    Mono<Boolean> archival =
        policy.hasArchiveBackend() ? startArchival(artifact) : Mono.just(Boolean.FALSE);

    pruneOldFiles();

    metrics.recordRotation(policyName, RotationMetrics.OUTCOME_SUCCESS);
    logger.info("Rotated {} to {}", file, artifact);
    return new RotationResult(artifact, archival);
  }

  /** Close, rename and reopen the active file. Must be called with the write lock held. */
  private Path rotateActiveFile() throws IOException {
    Path rotated = null;
    try {
      closeStream();
      if (Files.exists(file) && Files.size(file) > 0) {
        rotated = nextRotatedName(clock.instant());
        renamer.rename(file, rotated);
        logger.debug("Renamed {} to {}", file, rotated);
      }
    } finally {
      if (!closed) {
        openStream();
      }
    }
    lastRolloverTime = clock.instant();
    return rotated;
  }

  private Path nextRotatedName(Instant now) {
    String base = file.getFileName() + "." + ROTATION_TIMESTAMP.format(now);
    Path candidate = file.resolveSibling(base);
    int counter = 0;
    while (Files.exists(candidate)
        || Files.exists(candidate.resolveSibling(candidate.getFileName() + COMPRESSED_SUFFIX))) {
      counter++;
      candidate = file.resolveSibling(base + "." + counter);
    }
    return candidate;
  }

  private Path compress(Path source) throws CompressionException {
    Path target = source.resolveSibling(source.getFileName() + COMPRESSED_SUFFIX);
    long start = System.nanoTime();
    try (InputStream in = Files.newInputStream(source);
        OutputStream raw = Files.newOutputStream(target);
        OutputStream out = new LeveledGzipOutputStream(raw, policy.getCompressionLevel())) {
      in.transferTo(out);
    } catch (IOException e) {
      discardPartial(target);
      logger.error("Failed to compress {}: {}", source, e.getMessage(), e);
      throw new CompressionException("Failed to compress " + source, e);
    }
    try {
      // the compressed artifact keeps the modification time of the rotated file
      Files.setLastModifiedTime(target, Files.getLastModifiedTime(source));
      deleter.delete(source);
    } catch (IOException e) {
      discardPartial(target);
      logger.error("Failed to remove {} after compression: {}", source, e.getMessage(), e);
      throw new CompressionException("Failed to remove " + source + " after compression", e);
    }
    metrics.recordCompression(System.nanoTime() - start);
    logger.debug("Compressed {} to {}", source, target);
    return target;
  }

  private void discardPartial(Path target) {
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      logger.warn("Failed to remove partial compressed file {}: {}", target, e.getMessage());
    }
  }

  private Mono<Boolean> startArchival(Path artifact) {
    String backendName = policy.getArchiveBackendName();
    Mono<Boolean> archival;
    try {
      archival = archiveManager.archiveLog(artifact, backendName);
    } catch (ConfigurationException e) {
      logger.error("Failed to archive {}: {}", artifact, e.getMessage());
      return Mono.just(Boolean.FALSE);
    }
    Mono<Boolean> outcome =
        archival
            .doOnNext(
                archived -> {
                  if (archived) {
                    onArchived(artifact);
                  } else {
                    logger.debug("Archival of {} to backend {} failed", artifact, backendName);
                  }
                })
            .onErrorResume(
                e -> {
                  logger.error(
                      "Failed to archive {} to backend {}: {}",
                      artifact,
                      backendName,
                      e.getMessage(),
                      e);
                  return Mono.just(Boolean.FALSE);
                })
            .cache();
    outcome.subscribe();
    return outcome;
  }

  private void onArchived(Path artifact) {
    if (!policy.isDeleteAfterArchive()) {
      return;
    }
    try {
      deleter.delete(artifact);
      logger.info("Removed archived log {}", artifact);
    } catch (IOException e) {
      logger.error("Failed to remove archived log {}: {}", artifact, e.getMessage(), e);
    }
  }

  /**
   * Compress rotated artifacts left uncompressed, e.g. by a crash or a policy change. Does nothing
   * when the policy disables compression.
   *
   * @return number of artifacts compressed
   */
  public int compressOldFiles() {
    if (!policy.isCompressionEnabled()) {
      return 0;
    }
    maintenanceLock.lock();
    try {
      int compressed = 0;
      for (Path artifact : rotatedArtifacts()) {
        if (artifact.getFileName().toString().endsWith(COMPRESSED_SUFFIX)) {
          continue;
        }
        try {
          compress(artifact);
          compressed++;
        } catch (CompressionException e) {
          logger.warn("Leaving {} uncompressed until the next maintenance run", artifact);
        }
      }
      if (compressed > 0) {
        logger.info("Compressed {} leftover rotated logs of {}", compressed, file);
      }
      return compressed;
    } finally {
      maintenanceLock.unlock();
    }
  }

  /**
   * Delete rotated artifacts beyond the policy's {@code maxFiles}, oldest first. Deletion failures
   * are logged per file.
   *
   * @return number of artifacts deleted
   */
  public int pruneOldFiles() {
    maintenanceLock.lock();
    try {
      List<Path> artifacts = rotatedArtifacts();
      int keep = Math.min(policy.getMaxFiles(), artifacts.size());
      int deleted = 0;
      for (Path old : artifacts.subList(keep, artifacts.size())) {
        try {
          deleter.delete(old);
          deleted++;
          logger.debug("Removed old rotated log {}", old);
        } catch (IOException e) {
          logger.error("Failed to remove old log {}: {}", old, e.getMessage(), e);
        }
      }
      return deleted;
    } finally {
      maintenanceLock.unlock();
    }
  }

  /** Run the daily maintenance: prune, then compress leftovers. */
  public void runMaintenance() {
    maintenanceLock.lock();
    try {
      pruneOldFiles();
      compressOldFiles();
    } finally {
      maintenanceLock.unlock();
    }
  }

  /**
   * List the rotated artifacts of this log, compressed or not, newest first by modification time.
   * Ties are broken by the rotation timestamp and then the collision counter in the name.
   *
   * @return rotated artifacts
   */
  public List<Path> rotatedArtifacts() {
    List<RotatedArtifact> artifacts = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(file.getParent())) {
      for (Path path : stream) {
        Matcher matcher = artifactPattern.matcher(path.getFileName().toString());
        if (matcher.matches() && Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
          int counter = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
          artifacts.add(
              new RotatedArtifact(
                  path, Files.getLastModifiedTime(path).toInstant(), matcher.group(1), counter));
        }
      }
    } catch (IOException e) {
      logger.error("Failed to list rotated logs of {}: {}", file, e.getMessage(), e);
      return new ArrayList<>();
    }

    artifacts.sort(
        Comparator.comparing((RotatedArtifact artifact) -> artifact.modified)
            .thenComparing(artifact -> artifact.stamp)
            .thenComparingInt(artifact -> artifact.counter)
            .reversed());
    List<Path> paths = new ArrayList<>(artifacts.size());
    for (RotatedArtifact artifact : artifacts) {
      paths.add(artifact.path);
    }
    return paths;
  }

  private void openStream() throws IOException {
    stream = Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  private void closeStream() throws IOException {
    if (stream != null) {
      try {
        stream.close();
      } finally {
        stream = null;
      }
    }
  }

  private boolean sizeLimitReached() {
    try {
      return Files.size(file) >= policy.getMaxSizeBytes();
    } catch (NoSuchFileException e) {
      return false;
    } catch (IOException e) {
      logger.warn("Failed to read size of {}: {}", file, e.getMessage());
      return false;
    }
  }

  private boolean ageLimitReached() {
    Duration age = Duration.between(lastRolloverTime, clock.instant());
    return age.compareTo(policy.getMaxAge()) >= 0;
  }

  private boolean freeSpaceLow() {
    try {
      FileStore store = Files.getFileStore(file.getParent());
      return store.getUsableSpace() < policy.getMinFreeSpaceBytes();
    } catch (IOException e) {
      logger.warn("Failed to read free space of {}: {}", file.getParent(), e.getMessage());
      return false;
    }
  }

  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      closeStream();
      logger.debug("Closed rotating log {}", file);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "RotatingLogHandle[file=" + file + ", policy=" + policy.getName() + "]";
  }

  private static final class RotatedArtifact {
    final Path path;
    final Instant modified;
    final String stamp;
    final int counter;

    RotatedArtifact(Path path, Instant modified, String stamp, int counter) {
      this.path = path;
      this.modified = modified;
      this.stamp = stamp;
      this.counter = counter;
    }
  }

  /** GZIP stream with a configurable deflate level. */
  private static final class LeveledGzipOutputStream extends GZIPOutputStream {
    LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
      super(out);
      def.setLevel(level);
    }
  }
}
