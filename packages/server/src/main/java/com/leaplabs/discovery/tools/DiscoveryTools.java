package com.leaplabs.discovery.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.leaplabs.discovery.account.AccountSnapshot;
import com.leaplabs.discovery.account.AccountTracker;
import com.leaplabs.discovery.client.DiscoveryApi;
import com.leaplabs.discovery.estimate.CostEstimate;
import com.leaplabs.discovery.estimate.CostEstimator;
import com.leaplabs.discovery.estimate.Visibility;
import com.leaplabs.discovery.exception.DiscoveryException;
import com.leaplabs.discovery.exception.ExceptionUtil;
import com.leaplabs.discovery.exception.ValidationException;
import com.leaplabs.discovery.jobs.AnalysisRequest;
import com.leaplabs.discovery.jobs.AnalysisRequestValidator;
import com.leaplabs.discovery.jobs.JobLifecycleManager;
import com.leaplabs.discovery.jobs.JobStatusView;
import com.leaplabs.discovery.jobs.SubmissionReceipt;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * The operations behind the MCP tools. Each method validates its arguments, delegates to one
 * component and renders the outcome as JSON. Failures never escape: they become error responses
 * carrying the exception's code and context.
 */
public class DiscoveryTools {
  private static final org.slf4j.Logger log =
      com.leaplabs.discovery.logging.LoggingService.getLogger(DiscoveryTools.class);

  static final Set<String> PLANS = Set.of("free_tier", "tier_1", "tier_2");
  static final int CREDITS_PER_PACK = 20;

  private final DiscoveryApi api;
  private final JobLifecycleManager jobs;
  private final AccountTracker accounts;
  private final CostEstimator estimator;
  private final ApiKeyResolver keys;

  public DiscoveryTools(
      DiscoveryApi api,
      JobLifecycleManager jobs,
      AccountTracker accounts,
      CostEstimator estimator,
      ApiKeyResolver keys) {
    this.api = api;
    this.jobs = jobs;
    this.accounts = accounts;
    this.estimator = estimator;
    this.keys = keys;
  }

  public ToolResponse analyze(ToolArguments args) {
    return handle(
        "analyze",
        args,
        a -> {
          String apiKey = keys.require(a.optionalString("api_key"));
          AnalysisRequest request =
              AnalysisRequest.builder(
                      toPath(a.requiredString("file_path")), a.requiredString("target_column"))
                  .depth(a.intOrDefault("depth_iterations", 1))
                  .visibility(Visibility.parse(a.optionalString("visibility")))
                  .title(a.optionalString("title"))
                  .description(a.optionalString("description"))
                  .columnDescriptions(a.optionalStringMap("column_descriptions"))
                  .numColumns(a.optionalInt("num_columns"))
                  .idempotencyToken(a.optionalString("idempotency_key"))
                  .nonce(a.optionalString("nonce"))
                  .build();

          SubmissionReceipt receipt = jobs.submit(apiKey, request);
          Map<String, Object> body = new LinkedHashMap<>();
          body.put("run_id", receipt.runId());
          body.put("status", receipt.status().wireName());
          body.put("visibility", receipt.estimate().visibility().wireName());
          body.put("estimated_credits", receipt.estimate().credits());
          body.put("duplicate", receipt.duplicate());
          body.put("next_poll_seconds", receipt.nextPollSeconds());
          body.put(
              "message",
              "Run submitted. Poll discovery_status with this run_id, then call"
                  + " discovery_get_results once it is completed.");
          return body;
        });
  }

  public ToolResponse status(ToolArguments args) {
    return handle(
        "status",
        args,
        a -> {
          String apiKey = keys.require(a.optionalString("api_key"));
          return statusBody(jobs.poll(apiKey, a.requiredString("run_id")));
        });
  }

  public ToolResponse getResults(ToolArguments args) {
    return handle(
        "get_results",
        args,
        a -> {
          String apiKey = keys.require(a.optionalString("api_key"));
          JsonNode results = jobs.fetchResults(apiKey, a.requiredString("run_id"));
          Map<String, Object> body = new LinkedHashMap<>();
          body.put("results", results);
          body.put("hints", ResultHints.forResults(results));
          return body;
        });
  }

  /**
   * Local estimate. When an API key is known and the run is private, the current balance and
   * affordability are added together with the free public alternative. Public estimates are always
   * zero; a public depth above 1 is reported with a warning because submitting it would fail.
   */
  public ToolResponse estimate(ToolArguments args) {
    return handle(
        "estimate",
        args,
        a -> {
          int depth = a.intOrDefault("depth_iterations", 1);
          Visibility visibility = Visibility.parse(a.optionalString("visibility"));
          Integer numColumns = a.optionalInt("num_columns");
          AnalysisRequestValidator.checkDepth(depth, false);
          if (numColumns != null) {
            AnalysisRequestValidator.checkDepthAgainstColumns(depth, numColumns);
          }
          CostEstimate estimate =
              estimator.estimate(a.requiredDouble("file_size_mb"), depth, visibility);

          Map<String, Object> body = new LinkedHashMap<>();
          body.put("file_size_mb", estimate.fileSizeMb());
          body.put("depth_iterations", estimate.depth());
          body.put("visibility", visibility.wireName());
          body.put("estimated_credits", estimate.credits());
          body.put("free", estimate.isFree());
          if (visibility.isPublic() && depth > 1) {
            body.put(
                "warning",
                ("Public runs are limited to depth_iterations = 1; discovery_analyze will reject"
                        + " depth %d. Use visibility 'private' for deeper searches.")
                    .formatted(depth));
          }

          String apiKey = keys.resolve(a.optionalString("api_key"));
          if (!visibility.isPublic()) {
            body.put("free_public_alternative", depth == 1);
            if (apiKey != null) {
              AccountSnapshot account = accounts.snapshot(apiKey);
              body.put("balance", account.credits());
              body.put("sufficient_credits", accounts.canAfford(apiKey, estimate.credits()));
            }
          }
          return body;
        });
  }

  public ToolResponse signup(ToolArguments args) {
    return handle(
        "signup",
        args,
        a -> {
          String email = a.requiredString("email").trim();
          if (!email.contains("@")) {
            throw new ValidationException("email must be a valid email address.");
          }
          String name = a.optionalString("name");
          JsonNode created = api.signup(email, name == null || name.isBlank() ? null : name.trim());
          String newKey = created.path("api_key").asText(null);
          if (newKey != null) {
            accounts.invalidate(newKey);
          }
          return created;
        });
  }

  public ToolResponse account(ToolArguments args) {
    return handle(
        "account",
        args,
        a -> {
          AccountSnapshot snapshot = accounts.refresh(keys.require(a.optionalString("api_key")));
          return snapshot.raw() != null ? snapshot.raw() : snapshot;
        });
  }

  public ToolResponse listPlans(ToolArguments args) {
    return handle("list_plans", args, a -> api.listPlans());
  }

  public ToolResponse subscribe(ToolArguments args) {
    return handle(
        "subscribe",
        args,
        a -> {
          String apiKey = keys.require(a.optionalString("api_key"));
          String plan = a.requiredString("plan").trim();
          if (!PLANS.contains(plan)) {
            throw new ValidationException(
                "Unknown plan '%s'. Choose one of free_tier, tier_1, tier_2.".formatted(plan));
          }
          try {
            return api.subscribe(apiKey, plan);
          } finally {
            accounts.invalidate(apiKey);
          }
        });
  }

  public ToolResponse purchaseCredits(ToolArguments args) {
    return handle(
        "purchase_credits",
        args,
        a -> {
          String apiKey = keys.require(a.optionalString("api_key"));
          int packs = a.intOrDefault("packs", 1);
          if (packs < 1) {
            throw new ValidationException(
                "packs must be at least 1 (each pack is %d credits).".formatted(CREDITS_PER_PACK));
          }
          try {
            return api.purchaseCredits(apiKey, packs);
          } finally {
            accounts.invalidate(apiKey);
          }
        });
  }

  public ToolResponse addPaymentMethod(ToolArguments args) {
    return handle(
        "add_payment_method",
        args,
        a -> {
          String apiKey = keys.require(a.optionalString("api_key"));
          String paymentMethodId = a.requiredString("payment_method_id").trim();
          if (!paymentMethodId.startsWith("pm_")) {
            throw new ValidationException(
                "payment_method_id must be a Stripe payment method id (pm_...).");
          }
          try {
            return api.addPaymentMethod(apiKey, paymentMethodId);
          } finally {
            accounts.invalidate(apiKey);
          }
        });
  }

  private ToolResponse handle(
      String tool, ToolArguments args, Function<ToolArguments, Object> operation) {
    try {
      return ToolResponse.ok(operation.apply(args));
    } catch (DiscoveryException e) {
      log.info("discovery_{} failed: {}", tool, e.toString());
      return ToolResponse.error(ExceptionUtil.toErrorDetails(e));
    } catch (RuntimeException e) {
      log.error(
          "discovery_{} failed unexpectedly: {}", tool, ExceptionUtil.formatCompactStackTrace(e), e);
      return ToolResponse.error(ExceptionUtil.toErrorDetails(e));
    }
  }

  private static Map<String, Object> statusBody(JobStatusView view) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("run_id", view.runId());
    body.put("status", view.status().wireName());
    putIfNotNull(body, "job_id", view.remoteJobId());
    putIfNotNull(body, "job_status", view.remoteJobStatus());
    putIfNotNull(body, "error_message", view.failureReason());
    if (view.visibility() != null) {
      body.put("visibility", view.visibility().wireName());
    }
    putIfNotNull(body, "submitted_at", view.submittedAt());
    putIfNotNull(body, "last_polled_at", view.lastPolledAt());
    body.put("poll_count", view.pollCount());
    putIfNotNull(body, "estimated_credits", view.estimatedCredits());
    putIfNotNull(body, "next_poll_seconds", view.nextPollSeconds());
    return body;
  }

  private static void putIfNotNull(Map<String, Object> body, String key, Object value) {
    if (value != null) {
      body.put(key, value);
    }
  }

  private static Path toPath(String filePath) {
    try {
      return Paths.get(filePath.trim());
    } catch (InvalidPathException e) {
      throw new ValidationException("file_path is not a valid path: " + filePath, e);
    }
  }
}
