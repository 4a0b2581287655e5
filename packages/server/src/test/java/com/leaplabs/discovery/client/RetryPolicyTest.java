package com.leaplabs.discovery.client;

import static org.junit.jupiter.api.Assertions.*;

import com.leaplabs.discovery.exception.ServiceUnavailableException;
import com.leaplabs.discovery.exception.TransientNetworkException;
import com.leaplabs.discovery.exception.ValidationException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  private final List<Duration> waits = new CopyOnWriteArrayList<>();
  private final RetryPolicy policy =
      new RetryPolicy(4, Duration.ofMillis(10), Duration.ofMillis(100), waits::add);

  @Test
  void retriesTransientFailuresUntilSuccess() {
    AtomicInteger calls = new AtomicInteger();
    String result =
        policy.execute(
            "op",
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new TransientNetworkException("boom");
              }
              return "ok";
            });
    assertEquals("ok", result);
    assertEquals(3, calls.get());
    assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), waits);
  }

  @Test
  void exhaustedRetriesBecomeServiceUnavailable() {
    AtomicInteger calls = new AtomicInteger();
    ServiceUnavailableException e =
        assertThrows(
            ServiceUnavailableException.class,
            () ->
                policy.execute(
                    "op",
                    () -> {
                      calls.incrementAndGet();
                      throw new TransientNetworkException("down");
                    }));
    assertEquals(4, calls.get());
    assertEquals(3, waits.size());
    assertEquals(4, e.getContext().get("attempts"));
    assertInstanceOf(TransientNetworkException.class, e.getCause());
  }

  @Test
  void nonTransientFailuresAreNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    assertThrows(
        ValidationException.class,
        () ->
            policy.execute(
                "op",
                () -> {
                  calls.incrementAndGet();
                  throw new ValidationException("bad");
                }));
    assertEquals(1, calls.get());
    assertTrue(waits.isEmpty());
  }

  @Test
  void withoutRetriesMakesExactlyOneAttempt() {
    AtomicInteger calls = new AtomicInteger();
    ServiceUnavailableException e =
        assertThrows(
            ServiceUnavailableException.class,
            () ->
                policy
                    .withoutRetries()
                    .execute(
                        "purchase credits",
                        () -> {
                          calls.incrementAndGet();
                          throw new TransientNetworkException("gateway timeout");
                        }));
    assertEquals(1, calls.get());
    assertTrue(waits.isEmpty());
    assertTrue(e.getMessage().contains("not repeated"), e.getMessage());
  }

  @Test
  void retryAfterHintIsHonouredWithinTheCap() {
    TransientNetworkException shortHint =
        new TransientNetworkException("429", Map.of("retry_after_seconds", 0));
    TransientNetworkException longHint =
        new TransientNetworkException("429", Map.of("retry_after_seconds", 30));
    assertEquals(Duration.ofMillis(10), policy.delayBefore(2, shortHint));
    assertEquals(Duration.ofMillis(100), policy.delayBefore(2, longHint));
    assertEquals(Duration.ofMillis(100), policy.delayBefore(10, new TransientNetworkException("x")));
  }
}
