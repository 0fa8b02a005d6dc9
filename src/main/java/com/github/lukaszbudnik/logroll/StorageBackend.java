package com.github.lukaszbudnik.logroll;

import java.nio.file.Path;

/**
 * Destination capable of storing a rotated log artifact outside of its log directory.
 *
 * <p>Uploads may be retried by callers, so implementations must tolerate receiving the same file
 * more than once. Implementations report failures through the return value and never throw.
 */
@FunctionalInterface
public interface StorageBackend {

  /**
   * Upload a rotated log artifact. Called from a worker thread, may block on I/O.
   *
   * @param file the artifact to upload
   * @param contentHash hex-encoded SHA-256 of the artifact's bytes
   * @return true if the artifact was stored, false otherwise
   */
  boolean upload(Path file, String contentHash);
}
