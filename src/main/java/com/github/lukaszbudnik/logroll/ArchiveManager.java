package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Archives rotated log files to named storage backends.
 *
 * <p>Hashing and uploading block on I/O, so both run on a bounded worker pool owned by the manager
 * and are exposed as a {@link Mono}. Callers never wait for an upload unless they choose to block on
 * the returned publisher. Uploads are bounded by a timeout; a timed-out upload counts as failed.
 *
 * <p>Every successful upload is recorded in the {@link ArchiveRecordStore}. Failed uploads leave no
 * record behind.
 */
public class ArchiveManager implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveManager.class);

  static final int HASH_CHUNK_SIZE = 8 * 1024;
  static final String HASH_ALGORITHM = "SHA-256";

  private static final int WORKER_THREADS = 4;
  private static final int WORKER_QUEUE_CAPACITY = 1024;
  private static final int WORKER_TTL_SECONDS = 60;

  private final Map<String, StorageBackend> backends = new ConcurrentHashMap<>();
  private final ArchiveRecordStore recordStore;
  private final RotationMetrics metrics;
  private final Clock clock;
  private final Duration uploadTimeout;
  private final Scheduler workers;

  public ArchiveManager(
      ArchiveRecordStore recordStore, RotationMetrics metrics, Clock clock, Duration uploadTimeout) {
    this(
        recordStore,
        metrics,
        clock,
        uploadTimeout,
        Schedulers.newBoundedElastic(
            WORKER_THREADS, WORKER_QUEUE_CAPACITY, "log-archive", WORKER_TTL_SECONDS, true));
  }

  ArchiveManager(
      ArchiveRecordStore recordStore,
      RotationMetrics metrics,
      Clock clock,
      Duration uploadTimeout,
      Scheduler workers) {
    this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.uploadTimeout = Objects.requireNonNull(uploadTimeout, "uploadTimeout");
    this.workers = Objects.requireNonNull(workers, "workers");
  }

  /**
   * Register a storage backend under a name, replacing any backend registered under that name.
   *
   * @param name backend name referenced by rotation policies
   * @param backend the backend
   */
  public void registerBackend(String name, StorageBackend backend) {
    backends.put(name, Objects.requireNonNull(backend, "backend"));
    logger.info(
        "Registered storage backend: name={}, type={}", name, backend.getClass().getSimpleName());
  }

  public boolean hasBackend(String name) {
    return backends.containsKey(name);
  }

  public Set<String> getBackendNames() {
    return Collections.unmodifiableSet(new TreeSet<>(backends.keySet()));
  }

  public ArchiveRecordStore getRecordStore() {
    return recordStore;
  }

  /**
   * Archive a file to a named backend.
   *
   * <p>The returned publisher is lazy: nothing happens until it is subscribed. It emits {@code
   * true} once the file is uploaded and its {@link ArchiveRecord} is stored, {@code false} if the
   * backend rejected the upload or it timed out, and an {@link ArchivalException} error if the file
   * could not be hashed or the record could not be stored.
   *
   * @param file the rotated file to archive
   * @param backendName name of a registered backend
   * @return publisher of the archival outcome
   * @throws ConfigurationException if no backend is registered under {@code backendName}
   */
  public Mono<Boolean> archiveLog(Path file, String backendName) throws ConfigurationException {
    StorageBackend backend = backends.get(backendName);
    if (backend == null) {
      throw new ConfigurationException("Unknown storage backend: " + backendName);
    }
    return Mono.fromCallable(() -> calculateFileHash(file))
        .subscribeOn(workers)
        .flatMap(hash -> upload(backend, backendName, file, hash));
  }

  private Mono<Boolean> upload(StorageBackend backend, String backendName, Path file, String hash) {
    return Mono.fromCallable(() -> backend.upload(file, hash))
        .subscribeOn(workers)
        .timeout(uploadTimeout)
        .onErrorResume(
            TimeoutException.class,
            e -> {
              logger.warn(
                  "Upload of {} to {} timed out after {}", file, backendName, uploadTimeout);
              return Mono.just(false);
            })
        .flatMap(
            uploaded ->
                uploaded ? recordArchival(file, backendName, hash) : Mono.just(Boolean.FALSE));
  }

  private Mono<Boolean> recordArchival(Path file, String backendName, String hash) {
    return Mono.fromCallable(
            () -> {
              ArchiveRecord record =
                  new ArchiveRecord(
                      file.toAbsolutePath().normalize().toString(),
                      backendName,
                      hash,
                      clock.instant());
              try {
                metrics.recordArchiveSize(backendName, Files.size(file));
                recordStore.append(record);
              } catch (IOException e) {
                throw new ArchivalException("Failed to record archival of " + file, e);
              }
              logger.info("Archived {} to backend {} (sha256={})", file, backendName, hash);
              return Boolean.TRUE;
            })
        .subscribeOn(workers);
  }

  /**
   * Compute the hex-encoded SHA-256 digest of a file, streaming it in fixed-size chunks.
   *
   * @throws ArchivalException if the file cannot be read
   */
  static String calculateFileHash(Path file) throws ArchivalException {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance(HASH_ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(HASH_ALGORITHM + " not available", e);
    }
    byte[] buffer = new byte[HASH_CHUNK_SIZE];
    try (InputStream in = Files.newInputStream(file)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    } catch (IOException e) {
      throw new ArchivalException("Failed to read " + file + " for hashing", e);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  @Override
  public void close() {
    workers.dispose();
    logger.debug("Archive manager closed");
  }
}
