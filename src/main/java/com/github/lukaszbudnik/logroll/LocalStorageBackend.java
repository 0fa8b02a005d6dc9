package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Archives rotated files by copying them into a target directory under their own name. */
public class LocalStorageBackend implements StorageBackend {
  private static final Logger logger = LoggerFactory.getLogger(LocalStorageBackend.class);

  private final Path targetDirectory;

  public LocalStorageBackend(Path targetDirectory) throws ConfigurationException {
    this.targetDirectory = targetDirectory;
    try {
      Files.createDirectories(targetDirectory);
    } catch (IOException e) {
      throw new ConfigurationException(
          "Failed to create local archive directory " + targetDirectory, e);
    }
    logger.info("Local storage backend initialized: directory={}", targetDirectory);
  }

  @Override
  public boolean upload(Path file, String contentHash) {
    Path target = targetDirectory.resolve(file.getFileName());
    try {
      Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
      logger.debug("Copied {} to {} (hash={})", file, target, contentHash);
      return true;
    } catch (IOException e) {
      logger.error("Local archival failed for {}: {}", file, e.getMessage(), e);
      return false;
    }
  }

  public Path getTargetDirectory() {
    return targetDirectory;
  }
}
