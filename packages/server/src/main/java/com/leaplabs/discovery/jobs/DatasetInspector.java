package com.leaplabs.discovery.jobs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** File-system facts the validator needs. Swappable so tests can fake very large files. */
public interface DatasetInspector {

  /** Facts about a path; {@code realPath} is null when the file does not exist. */
  record Facts(Path realPath, boolean regularFile, long sizeBytes) {}

  Facts inspect(Path path) throws IOException;

  /** Resolves symlinks and {@code ..} segments before reporting. */
  static DatasetInspector fileSystem() {
    return path -> {
      Path real;
      try {
        real = path.toRealPath();
      } catch (NoSuchFileException e) {
        return new Facts(null, false, 0L);
      }
      boolean regular = Files.isRegularFile(real);
      return new Facts(real, regular, regular ? Files.size(real) : 0L);
    };
  }
}
