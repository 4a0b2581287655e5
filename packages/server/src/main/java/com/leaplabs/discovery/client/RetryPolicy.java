package com.leaplabs.discovery.client;

import com.leaplabs.discovery.exception.ServiceUnavailableException;
import com.leaplabs.discovery.exception.TransientNetworkException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.Either;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for {@link TransientNetworkException}s, built on a resilience4j
 * {@link Retry}. Every other exception passes through on the first attempt. Running out of
 * attempts raises {@link ServiceUnavailableException}.
 */
public final class RetryPolicy {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(RetryPolicy.class);

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final Consumer<Duration> retryListener;
  private final IntervalFunction backoff;
  private final RetryConfig config;

  public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    this(maxAttempts, initialBackoff, maxBackoff, delay -> {});
  }

  /**
   * @param retryListener told about every wait before the retry starts
   */
  public RetryPolicy(
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      Consumer<Duration> retryListener) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.retryListener = retryListener;
    this.backoff = IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0, maxBackoff);
    this.config =
        RetryConfig.<Object>custom()
            .maxAttempts(maxAttempts)
            .intervalBiFunction(this::intervalAfter)
            .retryExceptions(TransientNetworkException.class)
            .build();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Same error mapping with one attempt, for calls the service cannot de-duplicate. */
  public RetryPolicy withoutRetries() {
    return maxAttempts == 1
        ? this
        : new RetryPolicy(1, initialBackoff, maxBackoff, retryListener);
  }

  public <T> T execute(String operation, Supplier<T> call) {
    Retry retry = Retry.of(operation, config);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.warn(
                  "{} failed on attempt {}/{} ({}); retrying in {} ms",
                  operation,
                  event.getNumberOfRetryAttempts(),
                  maxAttempts,
                  event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage(),
                  event.getWaitInterval().toMillis());
              retryListener.accept(event.getWaitInterval());
            });
    try {
      return Retry.decorateSupplier(retry, call).get();
    } catch (TransientNetworkException e) {
      if (maxAttempts == 1) {
        throw new ServiceUnavailableException(
            ("%s: Discovery service did not confirm the request (%s). It was not repeated;"
                    + " check the account before trying again.")
                .formatted(operation, e.getMessage()),
            1,
            e);
      }
      throw new ServiceUnavailableException(
          "%s: Discovery service unavailable after %d attempt(s): %s"
              .formatted(operation, maxAttempts, e.getMessage()),
          maxAttempts,
          e);
    }
  }

  private long intervalAfter(Integer attempts, Either<Throwable, Object> outcome) {
    TransientNetworkException cause =
        outcome.isLeft() && outcome.getLeft() instanceof TransientNetworkException t ? t : null;
    return delayBefore(attempts + 1, cause).toMillis();
  }

  /**
   * Delay before the given attempt (2 = first retry). Doubles from the initial backoff, capped at
   * the max. A server supplied Retry-After wins when it is longer, within the same cap.
   */
  Duration delayBefore(int attempt, TransientNetworkException cause) {
    Duration delay = Duration.ofMillis(backoff.apply(Math.max(1, attempt - 1)));
    Object retryAfter = cause == null ? null : cause.getContext().get("retry_after_seconds");
    if (retryAfter instanceof Number n) {
      Duration hinted = Duration.ofSeconds(n.longValue());
      if (hinted.compareTo(delay) > 0) {
        delay = hinted.compareTo(maxBackoff) > 0 ? maxBackoff : hinted;
      }
    }
    return delay;
  }
}
