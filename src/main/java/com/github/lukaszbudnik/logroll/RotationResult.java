package com.github.lukaszbudnik.logroll;

import java.nio.file.Path;
import reactor.core.publisher.Mono;

/**
 * Outcome of a single rotation: the rotated artifact (if anything was rotated) and the pending
 * archival of that artifact.
 */
public final class RotationResult {

  private static final RotationResult NOTHING_ROTATED = new RotationResult(null, Mono.just(false));

  private final Path rotatedFile;
  private final Mono<Boolean> archival;

  RotationResult(Path rotatedFile, Mono<Boolean> archival) {
    this.rotatedFile = rotatedFile;
    this.archival = archival;
  }

  static RotationResult nothingRotated() {
    return NOTHING_ROTATED;
  }

  /** Whether the active file had content and was rotated. */
  public boolean isRotated() {
    return rotatedFile != null;
  }

  /** The rotated artifact, compressed if the policy compresses, or {@code null}. */
  public Path getRotatedFile() {
    return rotatedFile;
  }

  /**
   * Archival outcome of the rotated artifact. Archival is already running when the result is
   * returned; the publisher replays its outcome and never errors. Emits {@code false} when no
   * archive backend is configured or nothing was rotated.
   */
  public Mono<Boolean> getArchival() {
    return archival;
  }

  @Override
  public String toString() {
    return "RotationResult[rotatedFile=" + rotatedFile + "]";
  }
}
