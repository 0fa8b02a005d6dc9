package com.github.lukaszbudnik.logroll;

import java.nio.file.Path;
import java.util.Locale;

/** Creates storage backends from their configuration {@code type}. */
public final class StorageBackends {

  public static final String TYPE_LOCAL = "local";
  public static final String TYPE_SYSLOG = "syslog";
  public static final String TYPE_S3 = "s3";

  private StorageBackends() {}

  /**
   * Create the backend described by a configuration entry.
   *
   * @param name backend name, used in error messages
   * @param config backend configuration
   * @return a new backend
   * @throws ConfigurationException if the type is unknown or required options are missing
   */
  public static StorageBackend create(String name, BackendConfig config)
      throws ConfigurationException {
    switch (config.getType().toLowerCase(Locale.ROOT)) {
      case TYPE_LOCAL:
        return new LocalStorageBackend(Path.of(config.getRequiredOption("path")));
      case TYPE_SYSLOG:
        return new SyslogStorageBackend(config.getOption("address"));
      case TYPE_S3:
        return S3StorageBackend.fromConfig(config);
      default:
        throw new ConfigurationException(
            "Unknown type for storage backend "
                + name
                + ": "
                + config.getType()
                + ". Valid types are: local, syslog, s3");
    }
  }
}
