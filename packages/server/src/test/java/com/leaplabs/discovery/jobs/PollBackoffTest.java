package com.leaplabs.discovery.jobs;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class PollBackoffTest {

  @Test
  void doublesFromFloorUntilCap() {
    PollBackoff backoff = new PollBackoff(Duration.ofSeconds(5), Duration.ofSeconds(60));
    assertEquals(Duration.ofSeconds(5), backoff.delayAfter(0));
    assertEquals(Duration.ofSeconds(10), backoff.delayAfter(1));
    assertEquals(Duration.ofSeconds(20), backoff.delayAfter(2));
    assertEquals(Duration.ofSeconds(40), backoff.delayAfter(3));
    assertEquals(Duration.ofSeconds(60), backoff.delayAfter(4));
    assertEquals(Duration.ofSeconds(60), backoff.delayAfter(1_000));
  }

  @Test
  void rejectsCapBelowFloor() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new PollBackoff(Duration.ofSeconds(10), Duration.ofSeconds(5)));
  }
}
