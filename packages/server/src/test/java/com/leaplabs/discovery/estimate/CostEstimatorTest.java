package com.leaplabs.discovery.estimate;

import static org.junit.jupiter.api.Assertions.*;

import com.leaplabs.discovery.exception.ValidationException;
import org.junit.jupiter.api.Test;

class CostEstimatorTest {

  private final CostEstimator estimator = new CostEstimator();

  @Test
  void privateRunCostsSizeTimesDepthRoundedUp() {
    assertEquals(6, estimator.estimate(2.0, 3, Visibility.PRIVATE).credits());
    assertEquals(4, estimator.estimate(1.2, 3, Visibility.PRIVATE).credits());
  }

  @Test
  void tinyPrivateRunStillCostsOneCredit() {
    CostEstimate estimate = estimator.estimate(0.1, 1, Visibility.PRIVATE);
    assertEquals(1, estimate.credits());
    assertFalse(estimate.isFree());
  }

  @Test
  void publicRunIsFree() {
    CostEstimate estimate = estimator.estimate(500.0, 1, Visibility.PUBLIC);
    assertEquals(0, estimate.credits());
    assertTrue(estimate.isFree());
  }

  @Test
  void rejectsNonPositiveOrNonFiniteInput() {
    assertThrows(ValidationException.class, () -> estimator.estimate(0, 1, Visibility.PRIVATE));
    assertThrows(ValidationException.class, () -> estimator.estimate(-3, 1, Visibility.PRIVATE));
    assertThrows(
        ValidationException.class, () -> estimator.estimate(Double.NaN, 1, Visibility.PRIVATE));
    assertThrows(
        ValidationException.class,
        () -> estimator.estimate(Double.POSITIVE_INFINITY, 1, Visibility.PRIVATE));
    assertThrows(ValidationException.class, () -> estimator.estimate(1.0, 0, Visibility.PRIVATE));
  }

  @Test
  void costNeverDecreasesWithSizeOrDepth() {
    long previous = 0;
    for (double size = 0.25; size <= 8; size += 0.25) {
      long credits = estimator.estimate(size, 2, Visibility.PRIVATE).credits();
      assertTrue(credits >= previous, "size " + size);
      previous = credits;
    }
    previous = 0;
    for (int depth = 1; depth <= 10; depth++) {
      long credits = estimator.estimate(1.5, depth, Visibility.PRIVATE).credits();
      assertTrue(credits >= previous, "depth " + depth);
      previous = credits;
    }
  }

  @Test
  void byteCountIsConvertedToMebibytes() {
    CostEstimate estimate = estimator.estimateForBytes(3L * 1024 * 1024, 2, Visibility.PRIVATE);
    assertEquals(3.0, estimate.fileSizeMb(), 1e-9);
    assertEquals(6, estimate.credits());
  }
}
