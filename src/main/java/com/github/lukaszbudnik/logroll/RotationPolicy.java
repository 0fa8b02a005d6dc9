package com.github.lukaszbudnik.logroll;

import java.time.Duration;
import java.util.Objects;

/**
 * Named set of rotation thresholds and behaviors governing one or more log files.
 *
 * <p>Exactly the triggers whose threshold is set are active: size ({@link #getMaxSizeBytes()}),
 * age ({@link #getMaxAge()}) and free space ({@link #getMinFreeSpaceBytes()}). A policy without
 * any threshold never rotates automatically, only through a forced rotation.
 *
 * <p>Instances are immutable.
 */
public final class RotationPolicy {

  public static final int DEFAULT_MAX_FILES = 10;
  public static final int DEFAULT_COMPRESSION_LEVEL = 6;
  public static final int DEFAULT_RETENTION_DAYS = 30;

  private final String name;
  private final Long maxSizeBytes;
  private final Duration maxAge;
  private final int maxFiles;
  private final boolean compressionEnabled;
  private final int compressionLevel;
  private final String archiveBackendName;
  private final int retentionDays;
  private final Long minFreeSpaceBytes;
  private final boolean deleteAfterArchive;

  private RotationPolicy(Builder builder) {
    this.name = builder.name;
    this.maxSizeBytes = builder.maxSizeBytes;
    this.maxAge = builder.maxAge;
    this.maxFiles = builder.maxFiles;
    this.compressionEnabled = builder.compressionEnabled;
    this.compressionLevel = builder.compressionLevel;
    this.archiveBackendName = builder.archiveBackendName;
    this.retentionDays = builder.retentionDays;
    this.minFreeSpaceBytes = builder.minFreeSpaceBytes;
    this.deleteAfterArchive = builder.deleteAfterArchive;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  /** Size threshold in bytes, or {@code null} when the size trigger is disabled. */
  public Long getMaxSizeBytes() {
    return maxSizeBytes;
  }

  /** Age threshold, or {@code null} when the age trigger is disabled. */
  public Duration getMaxAge() {
    return maxAge;
  }

  /** Number of rotated artifacts to keep next to the active file. */
  public int getMaxFiles() {
    return maxFiles;
  }

  public boolean isCompressionEnabled() {
    return compressionEnabled;
  }

  public int getCompressionLevel() {
    return compressionLevel;
  }

  /** Name of the storage backend rotated files are archived to, or {@code null}. */
  public String getArchiveBackendName() {
    return archiveBackendName;
  }

  /**
   * Informational retention in days. Retention windows are enforced by {@link RetentionManager}
   * per log category.
   */
  public int getRetentionDays() {
    return retentionDays;
  }

  /** Free-space threshold in bytes, or {@code null} when the free-space trigger is disabled. */
  public Long getMinFreeSpaceBytes() {
    return minFreeSpaceBytes;
  }

  /** Whether a rotated artifact is removed locally once it has been archived successfully. */
  public boolean isDeleteAfterArchive() {
    return deleteAfterArchive;
  }

  public boolean hasSizeTrigger() {
    return maxSizeBytes != null;
  }

  public boolean hasAgeTrigger() {
    return maxAge != null;
  }

  public boolean hasFreeSpaceTrigger() {
    return minFreeSpaceBytes != null;
  }

  public boolean hasArchiveBackend() {
    return archiveBackendName != null;
  }

  @Override
  public String toString() {
    return String.format(
        "RotationPolicy[name=%s, maxSize=%s, maxAge=%s, maxFiles=%d, compression=%s/%d,"
            + " archiveTo=%s, minFreeSpace=%s]",
        name,
        maxSizeBytes,
        maxAge,
        maxFiles,
        compressionEnabled,
        compressionLevel,
        archiveBackendName,
        minFreeSpaceBytes);
  }

  /** Builder for {@link RotationPolicy}. Validation happens in {@link #build()}. */
  public static final class Builder {
    private final String name;
    private Long maxSizeBytes;
    private Duration maxAge;
    private int maxFiles = DEFAULT_MAX_FILES;
    private boolean compressionEnabled = true;
    private int compressionLevel = DEFAULT_COMPRESSION_LEVEL;
    private String archiveBackendName;
    private int retentionDays = DEFAULT_RETENTION_DAYS;
    private Long minFreeSpaceBytes;
    private boolean deleteAfterArchive;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder maxSizeBytes(Long maxSizeBytes) {
      this.maxSizeBytes = maxSizeBytes;
      return this;
    }

    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    public Builder maxFiles(int maxFiles) {
      this.maxFiles = maxFiles;
      return this;
    }

    public Builder compressionEnabled(boolean compressionEnabled) {
      this.compressionEnabled = compressionEnabled;
      return this;
    }

    public Builder compressionLevel(int compressionLevel) {
      this.compressionLevel = compressionLevel;
      return this;
    }

    public Builder archiveBackendName(String archiveBackendName) {
      this.archiveBackendName = archiveBackendName;
      return this;
    }

    public Builder retentionDays(int retentionDays) {
      this.retentionDays = retentionDays;
      return this;
    }

    public Builder minFreeSpaceBytes(Long minFreeSpaceBytes) {
      this.minFreeSpaceBytes = minFreeSpaceBytes;
      return this;
    }

    public Builder deleteAfterArchive(boolean deleteAfterArchive) {
      this.deleteAfterArchive = deleteAfterArchive;
      return this;
    }

    public RotationPolicy build() {
      if (maxSizeBytes != null && maxSizeBytes <= 0) {
        throw new IllegalArgumentException("maxSizeBytes must be > 0.");
      }
      if (maxAge != null && (maxAge.isZero() || maxAge.isNegative())) {
        throw new IllegalArgumentException("maxAge must be positive.");
      }
      if (maxFiles < 0) {
        throw new IllegalArgumentException("maxFiles must be >= 0.");
      }
      if (compressionLevel < 1 || compressionLevel > 9) {
        throw new IllegalArgumentException(
            "Invalid compression level: " + compressionLevel + ". Valid levels are: 1-9");
      }
      if (retentionDays < 0) {
        throw new IllegalArgumentException("retentionDays must be >= 0.");
      }
      if (minFreeSpaceBytes != null && minFreeSpaceBytes <= 0) {
        throw new IllegalArgumentException("minFreeSpaceBytes must be > 0.");
      }
      return new RotationPolicy(this);
    }
  }
}
