package com.leaplabs.discovery;

import com.leaplabs.discovery.account.AccountTracker;
import com.leaplabs.discovery.actuator.ActuatorService;
import com.leaplabs.discovery.client.DiscoveryApi;
import com.leaplabs.discovery.client.DiscoveryHttpClient;
import com.leaplabs.discovery.estimate.CostEstimator;
import com.leaplabs.discovery.exception.DiscoveryErrorCode;
import com.leaplabs.discovery.exception.DiscoveryException;
import com.leaplabs.discovery.http.EmbeddedJettyServer;
import com.leaplabs.discovery.jobs.AnalysisRequestValidator;
import com.leaplabs.discovery.jobs.JobLifecycleManager;
import com.leaplabs.discovery.jobs.PollBackoff;
import com.leaplabs.discovery.logging.LoggingService;
import com.leaplabs.discovery.mcp.McpServer;
import com.leaplabs.discovery.tools.ApiKeyResolver;
import com.leaplabs.discovery.tools.DiscoveryTools;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application container: loads configuration, wires the components and runs one transport. */
public class DiscoveryMcp {
  private static final org.slf4j.Logger log = LoggingService.getLogger(DiscoveryMcp.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private DiscoverySettings settings;
  private DiscoveryApi api;
  private AccountTracker accounts;
  private JobLifecycleManager jobs;
  private DiscoveryTools tools;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public DiscoveryMcp(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Silence java.util.logging; everything goes through SLF4J.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    String mode = startupParameters.mode();
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    if ("stdio".equals(mode)) {
      // stdout carries protocol frames from here on.
      LoggingService.switchToFileOnly(configuration().getString("logging.dir", "logs"));
    }

    this.settings = DiscoverySettings.fromConfiguration(configuration());
    wire(DiscoveryHttpClient.create(settings), Clock.systemUTC());
    log.info(
        "Discovery MCP initialised (api={}, dashboard={}, default key {})",
        settings.apiBaseUrl(),
        settings.dashboardBaseUrl(),
        settings.defaultApiKey() == null ? "absent" : "present");

    this.mcpServer = new McpServer(this);
    switch (mode) {
      case "server" -> startHttp();
      case "stdio" -> mcpServer.startStdio();
      default -> {
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + mode);
      }
    }
  }

  void wire(DiscoveryApi api, Clock clock) {
    this.api = api;
    this.accounts = new AccountTracker(api, clock, settings.accountStaleness());
    CostEstimator estimator = new CostEstimator();
    this.jobs =
        new JobLifecycleManager(
            api,
            accounts,
            estimator,
            new AnalysisRequestValidator(),
            new PollBackoff(settings.pollInitialDelay(), settings.pollMaxDelay()),
            clock,
            settings.jobTtl());
    this.tools =
        new DiscoveryTools(
            api, jobs, accounts, estimator, new ApiKeyResolver(settings.defaultApiKey()));
  }

  private void startHttp() {
    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      mcpServer.registerHttp();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new DiscoveryException(
          DiscoveryErrorCode.UNAVAILABLE, "Could not start the HTTP server", e);
    }
  }

  /** Block until the JVM is asked to exit, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "discovery-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call more than once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    try {
      if (mcpServer != null) {
        mcpServer.close();
      }
    } catch (RuntimeException e) {
      log.warn("Error closing MCP server", e);
    } finally {
      try {
        if (httpServer != null) {
          httpServer.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new DiscoveryException(
          DiscoveryErrorCode.FAILED_PRECONDITION,
          "DiscoveryMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public DiscoverySettings settings() {
    return settings;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public DiscoveryTools tools() {
    return tools;
  }

  public JobLifecycleManager jobs() {
    return jobs;
  }

  public int trackedRuns() {
    return jobs == null ? 0 : jobs.trackedJobs();
  }
}
