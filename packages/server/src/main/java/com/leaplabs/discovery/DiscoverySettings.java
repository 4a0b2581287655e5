package com.leaplabs.discovery;

import com.leaplabs.discovery.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Typed view over the {@code discovery.*} configuration keys, resolved once at startup so that
 * components receive plain values instead of reaching into the configuration tree.
 */
public record DiscoverySettings(
    String apiBaseUrl,
    String dashboardBaseUrl,
    String defaultApiKey,
    Duration connectTimeout,
    Duration readTimeout,
    Duration uploadTimeout,
    int retryMaxAttempts,
    Duration retryInitialBackoff,
    Duration retryMaxBackoff,
    Duration accountStaleness,
    Duration jobTtl,
    Duration pollInitialDelay,
    Duration pollMaxDelay) {

  public static final String DEFAULT_API_BASE_URL =
      "https://leap-labs-production--discovery-api.modal.run";
  public static final String DEFAULT_DASHBOARD_BASE_URL = "https://disco.leap-labs.com";

  public DiscoverySettings {
    if (retryMaxAttempts < 1) {
      throw new ConfigException("discovery.http.retry.max-attempts must be >= 1");
    }
    if (retryInitialBackoff.toMillis() < 1 || retryMaxBackoff.compareTo(retryInitialBackoff) < 0) {
      throw new ConfigException(
          "discovery.http.retry.initial-backoff-ms must be >= 1 and not above max-backoff-ms");
    }
    if (pollMaxDelay.compareTo(pollInitialDelay) < 0) {
      throw new ConfigException(
          "discovery.polling.max-seconds must not be lower than discovery.polling.initial-seconds");
    }
  }

  public static DiscoverySettings defaults() {
    return fromConfiguration(new YAMLConfiguration());
  }

  public static DiscoverySettings fromConfiguration(Configuration cfg) {
    try {
      return new DiscoverySettings(
          cfg.getString("discovery.api.base-url", DEFAULT_API_BASE_URL),
          cfg.getString("discovery.dashboard.base-url", DEFAULT_DASHBOARD_BASE_URL),
          resolvedOrNull(cfg.getString("discovery.api-key", null)),
          Duration.ofMillis(cfg.getLong("discovery.http.connect-timeout-ms", 10_000L)),
          Duration.ofMillis(cfg.getLong("discovery.http.read-timeout-ms", 30_000L)),
          Duration.ofMillis(cfg.getLong("discovery.http.upload-timeout-ms", 300_000L)),
          cfg.getInt("discovery.http.retry.max-attempts", 4),
          Duration.ofMillis(cfg.getLong("discovery.http.retry.initial-backoff-ms", 500L)),
          Duration.ofMillis(cfg.getLong("discovery.http.retry.max-backoff-ms", 8_000L)),
          Duration.ofSeconds(cfg.getLong("discovery.account.staleness-seconds", 60L)),
          Duration.ofMinutes(cfg.getLong("discovery.jobs.ttl-minutes", 120L)),
          Duration.ofSeconds(cfg.getLong("discovery.polling.initial-seconds", 5L)),
          Duration.ofSeconds(cfg.getLong("discovery.polling.max-seconds", 60L)));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid discovery.* configuration", e);
    }
  }

  /** An unresolvable {@code ${env:...}} placeholder comes back verbatim; treat it as unset. */
  private static String resolvedOrNull(String value) {
    if (value == null || value.isBlank() || value.startsWith("${")) {
      return null;
    }
    return value.trim();
  }
}
