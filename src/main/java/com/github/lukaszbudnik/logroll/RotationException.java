package com.github.lukaszbudnik.logroll;

/**
 * Thrown when the active log file cannot be renamed. The rotation attempt is aborted and the
 * active file is left in place.
 */
public class RotationException extends LogRotationException {

  public RotationException(String message, Throwable cause) {
    super(message, cause);
  }
}
