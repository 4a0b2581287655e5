package com.leaplabs.discovery.jobs;

import com.leaplabs.discovery.client.DatasetFormat;
import com.leaplabs.discovery.exception.IoException;
import com.leaplabs.discovery.exception.ValidationException;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Local checks on an {@link AnalysisRequest}. Runs before any network call, so a rejected request
 * never reaches the service and is never billed.
 */
public class AnalysisRequestValidator {

  /** Hard upload ceiling: 1 GiB. */
  public static final long MAX_FILE_SIZE_BYTES = 1024L * 1024L * 1024L;

  /** Columns that are never candidates for pattern conditions: the target and one spare. */
  static final int RESERVED_COLUMNS = 2;

  private final DatasetInspector inspector;

  public AnalysisRequestValidator() {
    this(DatasetInspector.fileSystem());
  }

  public AnalysisRequestValidator(DatasetInspector inspector) {
    this.inspector = inspector;
  }

  public DatasetFile validate(AnalysisRequest request) {
    if (request.targetColumn() == null || request.targetColumn().isBlank()) {
      throw new ValidationException("target_column must not be empty.");
    }
    checkDepth(request.depth(), request.visibility().isPublic());
    if (request.numColumns() != null) {
      checkDepthAgainstColumns(request.depth(), request.numColumns());
    }
    return checkFile(request);
  }

  public static void checkDepth(int depth, boolean publicRun) {
    if (depth < 1) {
      throw new ValidationException(
          "depth_iterations must be >= 1, got " + depth, Map.of("depth_iterations", depth));
    }
    if (publicRun && depth != 1) {
      throw new ValidationException(
          "Public runs are limited to depth_iterations = 1; use visibility 'private' for deeper"
              + " searches.",
          Map.of("depth_iterations", depth, "visibility", "public"));
    }
  }

  /** Depth may not exceed {@code numColumns - 2}. */
  public static void checkDepthAgainstColumns(int depth, int numColumns) {
    int maxDepth = numColumns - RESERVED_COLUMNS;
    if (maxDepth < 1) {
      throw new ValidationException(
          "Dataset needs at least %d columns for an analysis, it has %d."
              .formatted(RESERVED_COLUMNS + 1, numColumns),
          Map.of("num_columns", numColumns));
    }
    if (depth > maxDepth) {
      throw new ValidationException(
          "depth_iterations %d exceeds the maximum of %d for a dataset with %d columns."
              .formatted(depth, maxDepth, numColumns),
          Map.of("depth_iterations", depth, "max_depth", maxDepth, "num_columns", numColumns));
    }
  }

  private DatasetFile checkFile(AnalysisRequest request) {
    DatasetInspector.Facts facts;
    try {
      facts = inspector.inspect(request.dataset());
    } catch (IOException e) {
      throw new IoException("Cannot inspect dataset file " + request.dataset(), e);
    }
    if (facts.realPath() == null) {
      throw new ValidationException("File not found: " + request.dataset());
    }
    if (!facts.regularFile()) {
      throw new ValidationException("Not a file: " + request.dataset());
    }
    if (facts.sizeBytes() > MAX_FILE_SIZE_BYTES) {
      throw new ValidationException(
          "File too large (%.1f MB). Maximum: %d MB."
              .formatted(
                  facts.sizeBytes() / (1024d * 1024d), MAX_FILE_SIZE_BYTES / (1024L * 1024L)),
          Map.of("size_bytes", facts.sizeBytes(), "max_bytes", MAX_FILE_SIZE_BYTES));
    }
    if (facts.sizeBytes() == 0) {
      throw new ValidationException("File is empty.");
    }
    Optional<DatasetFormat> format =
        DatasetFormat.fromFileName(facts.realPath().getFileName().toString());
    if (format.isEmpty()) {
      throw new ValidationException(
          "Unsupported file type '%s'. Allowed: %s"
              .formatted(
                  extensionOf(facts.realPath().getFileName().toString()),
                  DatasetFormat.supportedExtensions()));
    }
    return new DatasetFile(facts.realPath(), facts.sizeBytes(), format.get());
  }

  private static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot).toLowerCase(java.util.Locale.ROOT);
  }
}
