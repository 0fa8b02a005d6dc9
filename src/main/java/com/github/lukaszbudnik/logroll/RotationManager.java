package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the rotation engine.
 *
 * <p>Built from a {@link RotationConfig}, the manager owns the storage backends, the archive record
 * store, the {@link ArchiveManager}, the {@link RetentionManager} and the {@link RotationScheduler}.
 * Log files are registered with {@link #createHandler(Path, String)}, which also schedules their
 * rotation checks. Nothing runs in the background until {@link #start()} is called.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * try (RotationManager manager = new RotationManager(RotationConfig.load(configFile))) {
 *   RotatingLogHandle log = manager.createHandler(Path.of("/var/log/app/app.log"), "default");
 *   manager.start();
 *   log.write("started\n");
 * }
 * }</pre>
 */
public class RotationManager implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RotationManager.class);

  private final RotationConfig config;
  private final RotationMetrics metrics;
  private final Clock clock;
  private final ArchiveRecordStore recordStore;
  private final ArchiveManager archiveManager;
  private final RetentionManager retentionManager;
  private final RotationScheduler scheduler;
  private final Map<Path, RotatingLogHandle> handlers = new ConcurrentHashMap<>();

  public RotationManager(RotationConfig config) throws ConfigurationException {
    this(config, Clock.systemUTC(), new RotationMetrics(), openRecordStore(config));
  }

  private RotationManager(
      RotationConfig config, Clock clock, RotationMetrics metrics, ArchiveRecordStore recordStore)
      throws ConfigurationException {
    this(
        config,
        clock,
        metrics,
        recordStore,
        new ArchiveManager(recordStore, metrics, clock, config.getUploadTimeout()),
        new RotationScheduler(clock));
  }

  RotationManager(
      RotationConfig config,
      Clock clock,
      RotationMetrics metrics,
      ArchiveRecordStore recordStore,
      ArchiveManager archiveManager,
      RotationScheduler scheduler)
      throws ConfigurationException {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
    this.archiveManager = Objects.requireNonNull(archiveManager, "archiveManager");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");

    try {
      registerBackends(config, archiveManager);
    } catch (ConfigurationException e) {
      archiveManager.close();
      try {
        recordStore.close();
      } catch (IOException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }

    this.retentionManager =
        new RetentionManager(
            config.getRetentionPolicies(),
            config.getLogDirectories(),
            recordStore,
            clock,
            FileDeleter.defaultDeleter(),
            this::isActiveFile);
    scheduler.scheduleRetentionCleanup(retentionManager);

    logger.info(
        "Rotation manager created: policies={}, backends={}, categories={}",
        config.getPolicies().keySet(),
        archiveManager.getBackendNames(),
        retentionManager.getCategories());
  }

  private static void registerBackends(RotationConfig config, ArchiveManager archiveManager)
      throws ConfigurationException {
    for (Map.Entry<String, BackendConfig> backend : config.getStorageBackends().entrySet()) {
      archiveManager.registerBackend(
          backend.getKey(), StorageBackends.create(backend.getKey(), backend.getValue()));
    }
    for (RotationPolicy policy : config.getPolicies().values()) {
      if (policy.hasArchiveBackend() && !archiveManager.hasBackend(policy.getArchiveBackendName())) {
        throw new ConfigurationException(
            "Policy " + policy.getName() + " archives to unknown storage backend: "
                + policy.getArchiveBackendName());
      }
    }
  }

  private static ArchiveRecordStore openRecordStore(RotationConfig config)
      throws ConfigurationException {
    try {
      return new JournalArchiveRecordStore(config.getArchiveMetadataDirectory());
    } catch (IOException e) {
      throw new ConfigurationException(
          "Failed to open archive metadata in " + config.getArchiveMetadataDirectory(), e);
    }
  }

  /**
   * Register a log file under a named policy and schedule its rotation checks.
   *
   * <p>Registering the same file again with the same policy returns the existing handle.
   *
   * @param file the active log file; created if missing
   * @param policyName name of a configured policy
   * @return the handle to write through
   * @throws ConfigurationException if the policy is unknown or the file is already registered
   *     under another policy
   * @throws IOException if the file cannot be opened
   */
  public RotatingLogHandle createHandler(Path file, String policyName)
      throws ConfigurationException, IOException {
    RotationPolicy policy = config.getPolicies().get(policyName);
    if (policy == null) {
      throw new ConfigurationException("Unknown rotation policy: " + policyName);
    }
    Path key = normalize(file);
    synchronized (handlers) {
      RotatingLogHandle existing = handlers.get(key);
      if (existing != null) {
        if (!existing.getPolicy().getName().equals(policyName)) {
          throw new ConfigurationException(
              key + " is already managed by policy " + existing.getPolicy().getName());
        }
        return existing;
      }
      RotatingLogHandle handle =
          new RotatingLogHandle(
              key,
              policy,
              policy.hasArchiveBackend() ? archiveManager : null,
              metrics,
              clock);
      handlers.put(key, handle);
      scheduler.scheduleRotationChecks(handle);
      logger.info("Created rotating log {} with policy {}", key, policyName);
      return handle;
    }
  }

  /**
   * Rotate a registered log file now, regardless of its triggers.
   *
   * @throws ConfigurationException if the file is not registered
   */
  public RotationResult forceRotation(Path file) throws LogRotationException {
    RotatingLogHandle handle = handlers.get(normalize(file));
    if (handle == null) {
      throw new ConfigurationException("No rotating log registered for " + file);
    }
    logger.info("Forcing rotation of {}", handle.getFile());
    return handle.doRollover();
  }

  public RotationPolicy getPolicy(String name) {
    return config.getPolicies().get(name);
  }

  public RotatingLogHandle getHandler(Path file) {
    return handlers.get(normalize(file));
  }

  public Collection<RotatingLogHandle> getHandlers() {
    return Collections.unmodifiableCollection(handlers.values());
  }

  public ArchiveManager getArchiveManager() {
    return archiveManager;
  }

  public RetentionManager getRetentionManager() {
    return retentionManager;
  }

  public RotationScheduler getScheduler() {
    return scheduler;
  }

  public RotationMetrics getMetrics() {
    return metrics;
  }

  /** Start the background scheduler. */
  public void start() {
    scheduler.start();
  }

  private boolean isActiveFile(Path path) {
    return handlers.containsKey(normalize(path));
  }

  private static Path normalize(Path file) {
    return file.toAbsolutePath().normalize();
  }

  @Override
  public void close() throws IOException {
    scheduler.close();
    List<IOException> failures = new ArrayList<>();
    for (RotatingLogHandle handle : handlers.values()) {
      try {
        handle.close();
      } catch (IOException e) {
        logger.error("Failed to close {}: {}", handle.getFile(), e.getMessage(), e);
        failures.add(e);
      }
    }
    archiveManager.close();
    try {
      recordStore.close();
    } catch (IOException e) {
      failures.add(e);
    }
    logger.info("Rotation manager closed");
    if (!failures.isEmpty()) {
      IOException failure = new IOException("Failed to close rotation manager cleanly");
      failures.forEach(failure::addSuppressed);
      throw failure;
    }
  }
}
