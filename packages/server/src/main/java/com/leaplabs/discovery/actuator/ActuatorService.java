package com.leaplabs.discovery.actuator;

import com.leaplabs.discovery.DiscoveryMcp;
import com.leaplabs.discovery.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health endpoint at {@code /actuator/health}, in the style of Spring Boot's actuator.
 *
 * <p>Reports {@code UP} together with the number of runs currently tracked in memory.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(ActuatorService.class);

  static final String PATH = "/actuator/health";

  private final DiscoveryMcp app;

  public ActuatorService(DiscoveryMcp app) {
    this.app = app;
  }

  public void register() {
    app.httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new HealthServlet(app::trackedRuns)), PATH);
    log.info("Actuator health endpoint registered at {}", PATH);
  }

  static class HealthServlet extends HttpServlet {
    private final transient Supplier<Integer> trackedRuns;

    HealthServlet(Supplier<Integer> trackedRuns) {
      this.trackedRuns = trackedRuns;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", "UP");
      body.put("tracked_runs", trackedRuns.get());
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(body));
      }
    }
  }
}
