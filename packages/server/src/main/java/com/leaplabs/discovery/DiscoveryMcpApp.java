package com.leaplabs.discovery;

public class DiscoveryMcpApp {

  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(DiscoveryMcpApp.class);

  public static void main(String[] args) {
    StartupParameters parameters;
    try {
      parameters = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage();
      System.exit(2);
      return;
    }
    if ("help".equals(parameters.mode())) {
      printUsage();
      return;
    }

    DiscoveryMcp app = new DiscoveryMcp(args);
    try {
      app.initialize();
    } catch (RuntimeException e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
    app.waitShutdownSignal();
  }

  private static void printUsage() {
    System.err.println(
        """
        Usage: discovery-mcp [--mode stdio|server|help] [--config-file <location>]

          --mode         stdio (default) speaks MCP on stdin/stdout;
                         server exposes MCP over HTTP with /actuator/health.
          --config-file  classpath:application.yaml (default), a file path or file: URI.

        The API key is read from DISCOVERY_API_KEY unless a tool call passes api_key.
        """);
  }
}
