package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistent store of {@link ArchiveRecord}s. Written by {@link ArchiveManager}, swept by {@link
 * RetentionManager}. Implementations must be thread-safe.
 */
public interface ArchiveRecordStore extends AutoCloseable {

  /**
   * Persist a new record.
   *
   * @throws IOException if the record could not be written
   */
  void append(ArchiveRecord record) throws IOException;

  /**
   * Find records archived strictly before the given instant, oldest first.
   *
   * @param cutoff exclusive upper bound of the archival time
   * @return matching records
   */
  List<ArchiveRecord> findArchivedBefore(Instant cutoff);

  /**
   * Find all records of artifacts with the given file name, oldest first.
   *
   * @param sourceFileName file name without directory
   * @return matching records
   */
  List<ArchiveRecord> findBySourceFileName(String sourceFileName);

  /**
   * Remove records from the store.
   *
   * @param records records to remove, unknown records are ignored
   * @return number of records removed
   * @throws IOException if the store could not be rewritten
   */
  int remove(Collection<ArchiveRecord> records) throws IOException;

  /** Get the number of records in the store */
  int size();

  @Override
  void close() throws IOException;
}
