package com.github.lukaszbudnik.logroll;

/** Outcome of one retention sweep over a log category. */
public final class RetentionStats {

  private final String category;
  private final int filesScanned;
  private final int filesDeleted;
  private final int deleteFailures;
  private final int recordsDeleted;

  public RetentionStats(
      String category, int filesScanned, int filesDeleted, int deleteFailures, int recordsDeleted) {
    this.category = category;
    this.filesScanned = filesScanned;
    this.filesDeleted = filesDeleted;
    this.deleteFailures = deleteFailures;
    this.recordsDeleted = recordsDeleted;
  }

  static RetentionStats empty(String category) {
    return new RetentionStats(category, 0, 0, 0, 0);
  }

  public String getCategory() {
    return category;
  }

  public int getFilesScanned() {
    return filesScanned;
  }

  public int getFilesDeleted() {
    return filesDeleted;
  }

  /** Local files and archive record batches that could not be deleted. */
  public int getDeleteFailures() {
    return deleteFailures;
  }

  public int getRecordsDeleted() {
    return recordsDeleted;
  }

  @Override
  public String toString() {
    return String.format(
        "RetentionStats[category=%s, scanned=%d, deleted=%d, failures=%d, records=%d]",
        category, filesScanned, filesDeleted, deleteFailures, recordsDeleted);
  }
}
