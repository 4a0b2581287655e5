package com.leaplabs.discovery.jobs;

import java.time.Duration;

/**
 * Suggested wait before the next status poll: starts at the floor and doubles per poll up to the
 * cap. Advisory only; the caller owns the polling loop.
 */
public final class PollBackoff {
  private final Duration floor;
  private final Duration cap;

  public PollBackoff(Duration floor, Duration cap) {
    if (floor.isNegative() || floor.isZero() || cap.compareTo(floor) < 0) {
      throw new IllegalArgumentException("Require 0 < floor <= cap");
    }
    this.floor = floor;
    this.cap = cap;
  }

  /** Delay after {@code pollCount} polls have been made (0 right after submission). */
  public Duration delayAfter(int pollCount) {
    int exponent = Math.min(Math.max(pollCount, 0), 20);
    long millis = floor.toMillis() << exponent;
    return millis >= cap.toMillis() ? cap : Duration.ofMillis(millis);
  }
}
