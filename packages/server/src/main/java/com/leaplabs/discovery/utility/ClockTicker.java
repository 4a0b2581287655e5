package com.leaplabs.discovery.utility;

import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Caffeine {@link Ticker} that reads an injected {@link Clock}, so cache expiry follows it.
 * Readings are nanoseconds since the ticker was created.
 */
public final class ClockTicker implements Ticker {
  private final Clock clock;
  private final Instant origin;

  private ClockTicker(Clock clock) {
    this.clock = clock;
    this.origin = clock.instant();
  }

  public static Ticker of(Clock clock) {
    return new ClockTicker(clock);
  }

  @Override
  public long read() {
    return Duration.between(origin, clock.instant()).toNanos();
  }
}
