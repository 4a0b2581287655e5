package com.leaplabs.discovery.estimate;

import com.leaplabs.discovery.exception.ValidationException;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic local credit estimate used for pre-flight affordability checks and for quoting a
 * price without submitting anything.
 *
 * <p>Private runs cost {@code max(1, ceil(fileSizeMb * depth))} credits; public runs cost nothing.
 * Invalid inputs are rejected, never clamped.
 */
public final class CostEstimator {

  private static final double BYTES_PER_MB = 1024d * 1024d;

  public CostEstimate estimate(double fileSizeMb, int depth, Visibility visibility) {
    Objects.requireNonNull(visibility, "visibility");
    if (Double.isNaN(fileSizeMb) || Double.isInfinite(fileSizeMb) || fileSizeMb <= 0) {
      throw new ValidationException(
          "file_size_mb must be a positive number, got " + fileSizeMb,
          Map.of("file_size_mb", String.valueOf(fileSizeMb)));
    }
    if (depth <= 0) {
      throw new ValidationException(
          "depth must be a positive integer, got " + depth, Map.of("depth", depth));
    }
    long credits =
        visibility.isPublic() ? 0L : Math.max(1L, (long) Math.ceil(fileSizeMb * depth));
    return new CostEstimate(fileSizeMb, depth, visibility, credits);
  }

  /** Convenience for callers holding a byte count, as read from the dataset file. */
  public CostEstimate estimateForBytes(long sizeBytes, int depth, Visibility visibility) {
    return estimate(sizeBytes / BYTES_PER_MB, depth, visibility);
  }
}
