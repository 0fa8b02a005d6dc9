package com.github.lukaszbudnik.logroll;

/**
 * Thrown when a rotation policy, storage backend or configuration value is unknown or malformed.
 * Fatal to the operation that requested it.
 */
public class ConfigurationException extends LogRotationException {

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
