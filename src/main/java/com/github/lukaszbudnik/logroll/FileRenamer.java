package com.github.lukaszbudnik.logroll;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Abstracts renaming to allow deterministic testing. */
@FunctionalInterface
interface FileRenamer {
  void rename(Path source, Path target) throws IOException;

  static FileRenamer defaultRenamer() {
    return (source, target) -> Files.move(source, target);
  }
}
