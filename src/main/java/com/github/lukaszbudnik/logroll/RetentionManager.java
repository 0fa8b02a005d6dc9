package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enforces per-category retention on local log files and archival records.
 *
 * <p>A sweep deletes local files whose modification time is strictly before {@code now -
 * localRetentionDays}, then removes archive records archived strictly before {@code now -
 * archiveRetentionDays}. Files and records exactly at a cutoff are kept. The compliance window is
 * never enforced by deletion.
 *
 * <p>Archive records belong to the category whose log directory holds their source file. Records
 * outside every configured log directory are removed once they are older than the longest archive
 * window of any category.
 *
 * <p>Files that are currently being written are never deleted.
 *
 * <p>Failures are handled per file: a file that cannot be inspected or deleted is logged and the
 * sweep continues.
 */
public class RetentionManager {
  private static final Logger logger = LoggerFactory.getLogger(RetentionManager.class);

  static final String LOG_FILE_GLOB = "*.log*";

  private final Map<String, RetentionPolicy> policies;
  private final Map<String, Path> logDirectories;
  private final ArchiveRecordStore recordStore;
  private final Clock clock;
  private final FileDeleter deleter;
  private final Predicate<Path> activeFiles;
  private final int longestArchiveRetentionDays;

  public RetentionManager(
      Map<String, RetentionPolicy> policies,
      Map<String, Path> logDirectories,
      ArchiveRecordStore recordStore,
      Clock clock,
      FileDeleter deleter) {
    this(policies, logDirectories, recordStore, clock, deleter, path -> false);
  }

  /**
   * @param activeFiles matches files that are currently being written; they are never deleted
   */
  public RetentionManager(
      Map<String, RetentionPolicy> policies,
      Map<String, Path> logDirectories,
      ArchiveRecordStore recordStore,
      Clock clock,
      FileDeleter deleter,
      Predicate<Path> activeFiles) {
    this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    this.logDirectories = Collections.unmodifiableMap(new LinkedHashMap<>(logDirectories));
    this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.deleter = Objects.requireNonNull(deleter, "deleter");
    this.activeFiles = Objects.requireNonNull(activeFiles, "activeFiles");
    int longest = 0;
    for (RetentionPolicy policy : this.policies.values()) {
      longest = Math.max(longest, policy.getArchiveRetentionDays());
    }
    this.longestArchiveRetentionDays = longest;
  }

  public Set<String> getCategories() {
    return policies.keySet();
  }

  public RetentionPolicy getPolicy(String category) {
    return policies.get(category);
  }

  /**
   * Sweep expired local files and archive records of one category.
   *
   * @param category log category, e.g. {@code application}
   * @return sweep statistics, empty if the category is unknown
   */
  public RetentionStats cleanupExpiredLogs(String category) {
    RetentionPolicy policy = policies.get(category);
    if (policy == null) {
      logger.warn("Skipping retention cleanup for unknown log category: {}", category);
      return RetentionStats.empty(category);
    }

    Instant now = clock.instant();
    Path directory = logDirectories.get(category);

    Instant localCutoff = now.minus(Duration.ofDays(policy.getLocalRetentionDays()));
    int scanned = 0;
    int deleted = 0;
    int failures = 0;
    if (directory == null) {
      logger.debug("No log directory configured for category {}, nothing to sweep", category);
    } else if (!Files.isDirectory(directory)) {
      logger.debug("Log directory {} of category {} does not exist", directory, category);
    } else {
      List<Path> candidates = new ArrayList<>();
      try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, LOG_FILE_GLOB)) {
        for (Path path : stream) {
          if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS) && !activeFiles.test(path)) {
            candidates.add(path);
          }
        }
      } catch (IOException e) {
        logger.error("Failed to list log directory {}: {}", directory, e.getMessage(), e);
        failures++;
      }
      scanned = candidates.size();
      for (Path path : candidates) {
        try {
          Instant modified = Files.getLastModifiedTime(path, LinkOption.NOFOLLOW_LINKS).toInstant();
          if (modified.isBefore(localCutoff)) {
            deleter.delete(path);
            deleted++;
            logger.info("Removed expired log file: {}", path);
          }
        } catch (IOException e) {
          failures++;
          logger.error("Failed to remove {}: {}", path, e.getMessage(), e);
        }
      }
    }

    Instant archiveCutoff = now.minus(Duration.ofDays(policy.getArchiveRetentionDays()));
    List<ArchiveRecord> expired = new ArrayList<>();
    if (directory != null) {
      for (ArchiveRecord record : recordStore.findArchivedBefore(archiveCutoff)) {
        if (record.isUnder(directory)) {
          expired.add(record);
        }
      }
    }
    Instant unattributedCutoff = now.minus(Duration.ofDays(longestArchiveRetentionDays));
    for (ArchiveRecord record : recordStore.findArchivedBefore(unattributedCutoff)) {
      if (!isAttributed(record)) {
        expired.add(record);
      }
    }
    int recordsDeleted = 0;
    try {
      recordsDeleted = recordStore.remove(expired);
    } catch (IOException e) {
      failures++;
      logger.error(
          "Failed to remove {} expired archive records of category {}: {}",
          expired.size(),
          category,
          e.getMessage(),
          e);
    }

    RetentionStats stats = new RetentionStats(category, scanned, deleted, failures, recordsDeleted);
    logger.info("Retention cleanup completed: {}", stats);
    return stats;
  }

  private boolean isAttributed(ArchiveRecord record) {
    for (Path directory : logDirectories.values()) {
      if (record.isUnder(directory)) {
        return true;
      }
    }
    return false;
  }

  /** Sweep every known category. */
  public List<RetentionStats> cleanupAll() {
    List<RetentionStats> stats = new ArrayList<>();
    for (String category : policies.keySet()) {
      stats.add(cleanupExpiredLogs(category));
    }
    return stats;
  }
}
