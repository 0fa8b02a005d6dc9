package com.github.lukaszbudnik.logroll;

/**
 * Thrown when a rotated file cannot be compressed. The partial compressed artifact is removed and
 * the uncompressed rotated file is kept.
 */
public class CompressionException extends LogRotationException {

  public CompressionException(String message, Throwable cause) {
    super(message, cause);
  }
}
