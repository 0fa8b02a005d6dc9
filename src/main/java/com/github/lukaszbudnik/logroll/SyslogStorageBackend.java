package com.github.lukaszbudnik.logroll;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder for forwarding rotated files to a syslog endpoint. The backend can be configured but
 * has no transport yet, so every upload reports failure.
 */
public class SyslogStorageBackend implements StorageBackend {
  private static final Logger logger = LoggerFactory.getLogger(SyslogStorageBackend.class);

  static final String DEFAULT_ADDRESS = "/dev/log";

  private final String address;

  public SyslogStorageBackend(String address) {
    this.address = address != null ? address : DEFAULT_ADDRESS;
  }

  @Override
  public boolean upload(Path file, String contentHash) {
    logger.info("Syslog backend upload not implemented: file={}, address={}", file, address);
    return false;
  }

  public String getAddress() {
    return address;
  }
}
