package com.leaplabs.discovery.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leaplabs.discovery.DiscoveryMcp;
import com.leaplabs.discovery.exception.ExceptionUtil;
import com.leaplabs.discovery.tools.ToolArguments;
import com.leaplabs.discovery.tools.ToolResponse;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Exposes the {@link ToolCatalog} over MCP, either through the SDK's streamable HTTP servlet
 * mounted on the shared Jetty context or through stdin/stdout.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> servlet path; default "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> reject HTTP DELETE; default false
 *   <li><b>http.mcp.server.name</b> name reported to clients; default "discovery-engine"
 *   <li><b>http.mcp.server.version</b> version reported to clients; default "0.1.0"
 * </ul>
 */
public class McpServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(McpServer.class);

  private final DiscoveryMcp app;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(DiscoveryMcp app) {
    this.app = app;
  }

  /** Mount the MCP servlet on the shared Jetty context. Jetty's lifecycle stays with the caller. */
  public void registerHttp() {
    String endpoint = normalizeEndpoint(app.configuration().getString("http.mcp.endpoint", "/mcp"));
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(jsonMapper())
            .mcpEndpoint(endpoint)
            .disallowDelete(app.configuration().getBoolean("http.mcp.disallow-delete", false))
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName(), serverVersion())
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(toolSpecifications())
            .build();

    app.httpServer().getContextHandler().addServlet(new ServletHolder(servletTransport), endpoint);
    log.info("MCP servlet registered at http://localhost:{}{}", app.httpServer().getPort(), endpoint);
  }

  /** Serve MCP over stdin/stdout. Nothing else may write to stdout afterwards. */
  public void startStdio() {
    StdioServerTransportProvider transport = new StdioServerTransportProvider(jsonMapper());
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(transport)
            .serverInfo(serverName(), serverVersion())
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(toolSpecifications())
            .build();
    log.info("MCP server listening on stdio");
  }

  List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
    return ToolCatalog.definitions(app.tools()).stream().map(McpServer::specification).toList();
  }

  static McpServerFeatures.SyncToolSpecification specification(
      ToolCatalog.ToolDefinition definition) {
    return McpServerFeatures.SyncToolSpecification.builder()
        .tool(
            McpSchema.Tool.builder()
                .name(definition.name())
                .description(definition.description())
                .inputSchema(
                    new McpSchema.JsonSchema(
                        "object",
                        definition.properties(),
                        definition.required(),
                        false,
                        Collections.emptyMap(),
                        Collections.emptyMap()))
                .build())
        .callHandler((exchange, request) -> invoke(definition, request.arguments()))
        .build();
  }

  static McpSchema.CallToolResult invoke(
      ToolCatalog.ToolDefinition definition, Map<String, Object> arguments) {
    ToolResponse response;
    try {
      response = definition.handler().apply(ToolArguments.of(arguments));
    } catch (RuntimeException e) {
      log.error("Tool {} failed outside its error handling", definition.name(), e);
      response = ToolResponse.error(ExceptionUtil.toErrorDetails(e));
    }
    return McpSchema.CallToolResult.builder()
        .addTextContent(response.content())
        .isError(response.error())
        .build();
  }

  @Override
  public void close() {
    try {
      if (mcpServer != null) {
        mcpServer.closeGracefully();
      }
    } finally {
      mcpServer = null;
      if (servletTransport != null) {
        servletTransport.destroy();
        servletTransport = null;
      }
    }
  }

  private String serverName() {
    return app.configuration().getString("http.mcp.server.name", "discovery-engine");
  }

  private String serverVersion() {
    return app.configuration().getString("http.mcp.server.version", "0.1.0");
  }

  // Protocol frames must stay on one line, so not the pretty-printing application mapper.
  private static JacksonMcpJsonMapper jsonMapper() {
    return new JacksonMcpJsonMapper(new ObjectMapper());
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
