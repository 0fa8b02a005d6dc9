package com.github.lukaszbudnik.logroll;

/** Signals a failed archival step. Never aborts a rotation. */
public class ArchivalException extends LogRotationException {

  public ArchivalException(String message, Throwable cause) {
    super(message, cause);
  }
}
