package com.github.lukaszbudnik.logroll;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Metadata of one successful archival: which rotated file went to which backend, its content hash
 * and when it was archived. Immutable.
 */
public final class ArchiveRecord {

  /** Orders records by archival time, then by file, backend and hash. */
  static final Comparator<ArchiveRecord> ARCHIVAL_ORDER =
      Comparator.comparing(ArchiveRecord::getArchivedAt)
          .thenComparing(ArchiveRecord::getSourceFile)
          .thenComparing(ArchiveRecord::getBackendName)
          .thenComparing(ArchiveRecord::getContentHash);

  private final String sourceFile;
  private final String backendName;
  private final String contentHash;
  private final Instant archivedAt;

  public ArchiveRecord(
      String sourceFile, String backendName, String contentHash, Instant archivedAt) {
    this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
    this.backendName = Objects.requireNonNull(backendName, "backendName");
    this.contentHash = Objects.requireNonNull(contentHash, "contentHash");
    this.archivedAt = Objects.requireNonNull(archivedAt, "archivedAt");
  }

  /** Absolute path of the archived artifact at the time it was archived. */
  public String getSourceFile() {
    return sourceFile;
  }

  public String getSourceFileName() {
    int separator = Math.max(sourceFile.lastIndexOf('/'), sourceFile.lastIndexOf('\\'));
    return sourceFile.substring(separator + 1);
  }

  public String getBackendName() {
    return backendName;
  }

  public String getContentHash() {
    return contentHash;
  }

  public Instant getArchivedAt() {
    return archivedAt;
  }

  /** Whether the archived artifact was located under the given directory. */
  boolean isUnder(Path directory) {
    try {
      return Path.of(sourceFile).normalize().startsWith(directory.toAbsolutePath().normalize());
    } catch (InvalidPathException e) {
      return false;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ArchiveRecord that = (ArchiveRecord) o;
    return sourceFile.equals(that.sourceFile)
        && backendName.equals(that.backendName)
        && contentHash.equals(that.contentHash)
        && archivedAt.equals(that.archivedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceFile, backendName, contentHash, archivedAt);
  }

  @Override
  public String toString() {
    return String.format(
        "ArchiveRecord[file=%s, backend=%s, hash=%s, archivedAt=%s]",
        sourceFile, backendName, contentHash, archivedAt);
  }
}
