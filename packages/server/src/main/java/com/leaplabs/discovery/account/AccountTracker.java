package com.leaplabs.discovery.account;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.leaplabs.discovery.client.DiscoveryApi;
import com.leaplabs.discovery.utility.ClockTicker;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Per-credential cache of {@link AccountSnapshot}s.
 *
 * <p>Reads serve the cached snapshot until it is older than the staleness bound. Any operation
 * that mutates remote account state must call {@link #invalidate(String)} (or {@link
 * #invalidateAll()} when the affected credential is unknown). Invalidation wins over a refresh
 * that was already in flight: such a refresh returns its result to its own caller but does not
 * repopulate the cache.
 */
public class AccountTracker {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(AccountTracker.class);

  private final DiscoveryApi api;
  private final Clock clock;
  // The pending future is cached before the fetch starts, so invalidate() can drop it mid-flight.
  private final AsyncCache<String, AccountSnapshot> snapshots;

  public AccountTracker(DiscoveryApi api, Clock clock, Duration staleness) {
    this.api = api;
    this.clock = clock;
    this.snapshots =
        Caffeine.newBuilder()
            .expireAfterWrite(staleness)
            .ticker(ClockTicker.of(clock))
            .executor(Runnable::run)
            .buildAsync();
  }

  /** Cached snapshot, fetched when absent, invalidated, or older than the staleness bound. */
  public AccountSnapshot snapshot(String apiKey) {
    CompletableFuture<AccountSnapshot> pending = new CompletableFuture<>();
    CompletableFuture<AccountSnapshot> current = snapshots.asMap().putIfAbsent(apiKey, pending);
    if (current != null) {
      return await(current);
    }
    return load(apiKey, pending);
  }

  /** Bypass the cache and fetch the account now. */
  public AccountSnapshot refresh(String apiKey) {
    CompletableFuture<AccountSnapshot> pending = new CompletableFuture<>();
    snapshots.put(apiKey, pending);
    return load(apiKey, pending);
  }

  /**
   * Whether the cached balance covers {@code creditsNeeded}. Does not force a network call unless
   * the cache is empty or stale. A negative balance is never affordable.
   */
  public boolean canAfford(String apiKey, long creditsNeeded) {
    AccountSnapshot current = snapshot(apiKey);
    if (current.credits() < 0) {
      return false;
    }
    return current.credits() >= creditsNeeded;
  }

  public void invalidate(String apiKey) {
    snapshots.synchronous().invalidate(apiKey);
    log.debug("Account snapshot invalidated");
  }

  public void invalidateAll() {
    snapshots.synchronous().invalidateAll();
    log.debug("All account snapshots invalidated");
  }

  private AccountSnapshot load(String apiKey, CompletableFuture<AccountSnapshot> pending) {
    AccountSnapshot fresh;
    try {
      fresh = AccountSnapshot.fromJson(api.account(apiKey), clock.instant());
    } catch (RuntimeException e) {
      // Failed futures are dropped from the cache.
      pending.completeExceptionally(e);
      throw e;
    }
    pending.complete(fresh);
    if (snapshots.getIfPresent(apiKey) != pending) {
      log.debug("Account refresh raced with an invalidation; not cached");
    }
    log.debug("Account refreshed: plan={}, credits={}", fresh.plan(), fresh.credits());
    return fresh;
  }

  private static AccountSnapshot await(CompletableFuture<AccountSnapshot> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) {
        throw re;
      }
      throw e;
    }
  }
}
