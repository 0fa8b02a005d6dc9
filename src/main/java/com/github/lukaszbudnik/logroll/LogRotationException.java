package com.github.lukaszbudnik.logroll;

/** Base exception thrown when log rotation, archival or configuration operations fail */
public class LogRotationException extends Exception {

  public LogRotationException(String message) {
    super(message);
  }

  public LogRotationException(String message, Throwable cause) {
    super(message, cause);
  }

  public LogRotationException(Throwable cause) {
    super(cause);
  }
}
