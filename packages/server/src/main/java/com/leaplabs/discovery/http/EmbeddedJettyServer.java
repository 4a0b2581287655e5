package com.leaplabs.discovery.http;

import com.leaplabs.discovery.DiscoveryMcp;
import com.leaplabs.discovery.exception.ConfigException;
import com.leaplabs.discovery.exception.ExceptionUtil;
import com.leaplabs.discovery.exception.IoException;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}, used in server mode.
 *
 * <p>Owns the Jetty lifecycle and exposes the context handler so the MCP transport and the
 * actuator can mount their servlets before {@link #start()}.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private final DiscoveryMcp app;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(DiscoveryMcp app) {
    this.app = app;
  }

  /** Create the server and root context without binding the port. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        return;
      }

      int port = app.configuration().getInt("http.port", 8080);
      if (port < 0 || port > 65535) {
        throw new ConfigException("http.port out of range: " + port);
      }
      String hostname = app.configuration().getString("http.hostname", "0.0.0.0");
      if (hostname == null || hostname.isBlank()) {
        throw new ConfigException("Missing http.hostname configuration");
      }

      server = new Server();
      ServerConnector connector = new ServerConnector(server);
      connector.setHost(hostname.trim());
      connector.setPort(port);
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");
      server.setHandler(contextHandler);
      log.trace("Jetty prepared for {}:{}", hostname.trim(), port);
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            ex ->
                new IoException(
                    "Could not start the HTTP listener. Check that http.port and http.hostname"
                        + " are available to this process.",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isStarted() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        // Logged only, so that shutdown of the remaining services carries on.
        log.error("Error stopping Jetty", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return server.getURI().getPort();
      }
      return app.configuration().getInt("http.port", 8080);
    }
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
