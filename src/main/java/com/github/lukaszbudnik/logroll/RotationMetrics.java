package com.github.lukaszbudnik.logroll;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe metrics tracking for rotation, compression and archival events.
 *
 * <p>Counters are cumulative and updated with atomic operations. Recording a metric never fails and
 * never affects the rotation that reports it.
 */
public class RotationMetrics {

  public static final String OUTCOME_START = "start";
  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";

  // Rotation metrics, keyed by policy and outcome
  private final ConcurrentMap<String, AtomicLong> rotations = new ConcurrentHashMap<>();

  // Compression metrics
  private final AtomicLong compressions = new AtomicLong();
  private final AtomicLong compressionNanos = new AtomicLong();
  private final AtomicLong maxCompressionNanos = new AtomicLong();

  // Archive metrics, keyed by backend
  private final ConcurrentMap<String, AtomicLong> archiveSizes = new ConcurrentHashMap<>();

  /**
   * Get the number of rotations recorded for a policy with the given outcome.
   *
   * @param policyName rotation policy name
   * @param outcome one of {@link #OUTCOME_START}, {@link #OUTCOME_SUCCESS}, {@link
   *     #OUTCOME_FAILURE}
   * @return cumulative count
   */
  public long getRotations(String policyName, String outcome) {
    AtomicLong counter = rotations.get(rotationKey(policyName, outcome));
    return counter != null ? counter.get() : 0;
  }

  /**
   * Get the total number of compressed rotated files.
   *
   * @return cumulative count of compressions
   */
  public long getCompressions() {
    return compressions.get();
  }

  /**
   * Get the total time spent compressing rotated files.
   *
   * @return cumulative compression time
   */
  public Duration getTotalCompressionTime() {
    return Duration.ofNanos(compressionNanos.get());
  }

  /**
   * Get the longest single compression observed.
   *
   * @return maximum compression time
   */
  public Duration getMaxCompressionTime() {
    return Duration.ofNanos(maxCompressionNanos.get());
  }

  /**
   * Get the size of the last file archived to a backend.
   *
   * @param backendName storage backend name
   * @return size in bytes, or 0 if nothing was archived to the backend yet
   */
  public long getArchiveSize(String backendName) {
    AtomicLong gauge = archiveSizes.get(backendName);
    return gauge != null ? gauge.get() : 0;
  }

  // Package-private methods for internal metric updates

  void recordRotation(String policyName, String outcome) {
    rotations.computeIfAbsent(rotationKey(policyName, outcome), key -> new AtomicLong())
        .incrementAndGet();
  }

  void recordCompression(long nanos) {
    compressions.incrementAndGet();
    compressionNanos.addAndGet(nanos);
    maxCompressionNanos.accumulateAndGet(nanos, Math::max);
  }

  void recordArchiveSize(String backendName, long bytes) {
    archiveSizes.computeIfAbsent(backendName, key -> new AtomicLong()).set(bytes);
  }

  private static String rotationKey(String policyName, String outcome) {
    return policyName + "/" + outcome;
  }
}
