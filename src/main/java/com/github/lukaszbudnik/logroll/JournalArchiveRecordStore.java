package com.github.lukaszbudnik.logroll;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded {@link ArchiveRecordStore} backed by an append-only JSON-lines journal.
 *
 * <p>Every record is one line of the journal ({@code archive-records.jsonl}); all records are
 * indexed in memory by archival time so retention sweeps are range queries. Appends write a single
 * line, removals rewrite the journal to a temporary file and atomically move it into place.
 *
 * <p>Lines that cannot be parsed, including a trailing line truncated by a crash, are skipped with a
 * warning when the journal is opened, and the journal is compacted so they never resurface.
 */
public class JournalArchiveRecordStore implements ArchiveRecordStore {
  private static final Logger logger = LoggerFactory.getLogger(JournalArchiveRecordStore.class);

  static final String JOURNAL_FILE = "archive-records.jsonl";
  private static final String JOURNAL_TMP_SUFFIX = ".tmp";

  private static final Gson GSON = new Gson();

  private final Path journal;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final NavigableSet<ArchiveRecord> records =
      new TreeSet<>(ArchiveRecord.ARCHIVAL_ORDER);

  public JournalArchiveRecordStore(Path directory) throws IOException {
    Files.createDirectories(directory);
    this.journal = directory.resolve(JOURNAL_FILE);
    load();
    logger.info("Archive record store opened: journal={}, records={}", journal, records.size());
  }

  private void load() throws IOException {
    if (!Files.exists(journal)) {
      return;
    }
    // Decode leniently, a torn write may leave invalid UTF-8 behind
    String content = new String(Files.readAllBytes(journal), StandardCharsets.UTF_8);
    int lineNumber = 0;
    int skipped = 0;
    for (String line : content.split("\n")) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      try {
        records.add(fromJson(line));
      } catch (JsonParseException | IllegalStateException | DateTimeParseException e) {
        skipped++;
        logger.warn(
            "Skipping unreadable archive record at {}:{}: {}", journal, lineNumber, e.getMessage());
      }
    }
    if (skipped > 0 || (!content.isEmpty() && !content.endsWith("\n"))) {
      logger.info(
          "Compacting archive journal {} after skipping {} unreadable records", journal, skipped);
      rewrite();
    }
  }

  @Override
  public void append(ArchiveRecord record) throws IOException {
    lock.writeLock().lock();
    try {
      Files.writeString(
          journal,
          toJson(record) + "\n",
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.APPEND);
      records.add(record);
      logger.debug("Appended archive record: {}", record);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<ArchiveRecord> findArchivedBefore(Instant cutoff) {
    lock.readLock().lock();
    try {
      List<ArchiveRecord> result = new ArrayList<>();
      for (ArchiveRecord record : records) {
        if (!record.getArchivedAt().isBefore(cutoff)) {
          // sorted by archival time, nothing older follows
          break;
        }
        result.add(record);
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<ArchiveRecord> findBySourceFileName(String sourceFileName) {
    lock.readLock().lock();
    try {
      List<ArchiveRecord> result = new ArrayList<>();
      for (ArchiveRecord record : records) {
        if (record.getSourceFileName().equals(sourceFileName)) {
          result.add(record);
        }
      }
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public int remove(Collection<ArchiveRecord> toRemove) throws IOException {
    if (toRemove.isEmpty()) {
      return 0;
    }
    lock.writeLock().lock();
    try {
      List<ArchiveRecord> removed = new ArrayList<>();
      for (ArchiveRecord record : toRemove) {
        if (records.remove(record)) {
          removed.add(record);
        }
      }
      if (removed.isEmpty()) {
        return 0;
      }
      try {
        rewrite();
      } catch (IOException e) {
        // keep the in-memory index consistent with the journal on disk
        records.addAll(removed);
        throw e;
      }
      logger.debug("Removed {} archive records, {} remaining", removed.size(), records.size());
      return removed.size();
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public int size() {
    lock.readLock().lock();
    try {
      return records.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void close() {
    logger.debug("Archive record store closed: journal={}", journal);
  }

  Path getJournal() {
    return journal;
  }

  private void rewrite() throws IOException {
    Path tmp = journal.resolveSibling(JOURNAL_FILE + JOURNAL_TMP_SUFFIX);
    try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
      for (ArchiveRecord record : records) {
        writer.write(toJson(record));
        writer.write('\n');
      }
    }
    try {
      Files.move(tmp, journal, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, journal, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  static String toJson(ArchiveRecord record) {
    JsonObject json = new JsonObject();
    json.addProperty("file", record.getSourceFile());
    json.addProperty("backend", record.getBackendName());
    json.addProperty("hash", record.getContentHash());
    json.addProperty("timestamp", record.getArchivedAt().toString());
    return GSON.toJson(json);
  }

  static ArchiveRecord fromJson(String line) {
    JsonElement element = JsonParser.parseString(line);
    JsonObject json = element.getAsJsonObject();
    return new ArchiveRecord(
        requiredString(json, "file"),
        requiredString(json, "backend"),
        requiredString(json, "hash"),
        Instant.parse(requiredString(json, "timestamp")));
  }

  private static String requiredString(JsonObject json, String member) {
    JsonElement element = json.get(member);
    if (element == null || !element.isJsonPrimitive()) {
      throw new JsonParseException("Missing field: " + member);
    }
    return element.getAsString();
  }
}
