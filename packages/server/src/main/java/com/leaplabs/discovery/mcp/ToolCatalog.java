package com.leaplabs.discovery.mcp;

import com.leaplabs.discovery.tools.DiscoveryTools;
import com.leaplabs.discovery.tools.ToolArguments;
import com.leaplabs.discovery.tools.ToolResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Names, descriptions and input schemas of the MCP tools, each bound to its handler. */
public final class ToolCatalog {

  /** One tool: what the agent sees, and what runs when it is called. */
  public record ToolDefinition(
      String name,
      String description,
      Map<String, Object> properties,
      List<String> required,
      Function<ToolArguments, ToolResponse> handler) {}

  private static final Map<String, Object> API_KEY =
      property(
          "string",
          "Discovery Engine API key (disco_...). Optional if DISCOVERY_API_KEY is set.");

  private ToolCatalog() {}

  public static List<ToolDefinition> definitions(DiscoveryTools tools) {
    return List.of(
        new ToolDefinition(
            "discovery_analyze",
            "Run Discovery Engine on a tabular dataset to find novel, statistically validated"
                + " patterns. Long-running (minutes): returns a run_id immediately. Poll"
                + " discovery_status, then call discovery_get_results. Public runs are free and"
                + " published; private runs cost credits, call discovery_estimate first.",
            properties(
                "file_path",
                property(
                    "string",
                    "Path to the dataset (CSV, TSV, Excel, JSON, Parquet, ARFF, Feather)."),
                "target_column",
                property("string", "The column to explain."),
                "depth_iterations",
                property("integer", "Search depth, 1 = fast. Public runs allow only 1."),
                "visibility",
                visibility(),
                "title",
                property("string", "Optional title for the analysis."),
                "description",
                property("string", "Optional description of the dataset."),
                "column_descriptions",
                Map.of(
                    "type",
                    "object",
                    "description",
                    "Optional column name to description map.",
                    "additionalProperties",
                    Map.of("type", "string")),
                "num_columns",
                property("integer", "Column count, if known, to validate depth before upload."),
                "idempotency_key",
                property(
                    "string", "Reuse the same key when retrying a submission to avoid paying twice."),
                "nonce",
                property(
                    "string",
                    "Without idempotency_key, a key is derived from the file contents, the"
                        + " settings and this value. Repeat it to retry; change it to run the"
                        + " same data again."),
                "api_key",
                API_KEY),
            List.of("file_path", "target_column"),
            tools::analyze),
        new ToolDefinition(
            "discovery_status",
            "Check the status of a run (queued, running, completed, failed, expired). Lightweight;"
                + " the response suggests when to poll next.",
            properties(
                "run_id", property("string", "Run id returned by discovery_analyze."),
                "api_key", API_KEY),
            List.of("run_id"),
            tools::status),
        new ToolDefinition(
            "discovery_get_results",
            "Fetch the full results of a completed run: patterns, feature importance, summary and"
                + " report URL. Only call after discovery_status reports completed.",
            properties(
                "run_id", property("string", "Run id returned by discovery_analyze."),
                "api_key", API_KEY),
            List.of("run_id"),
            tools::getResults),
        new ToolDefinition(
            "discovery_estimate",
            "Estimate the credit cost of a run before submitting it. With an API key, also reports"
                + " the balance and whether it covers a private run. Public runs are free and"
                + " limited to depth 1.",
            properties(
                "file_size_mb",
                property("number", "Dataset size in megabytes."),
                "num_columns",
                property("integer", "Number of columns in the dataset."),
                "depth_iterations",
                property("integer", "Search depth. Default 1."),
                "visibility",
                visibility(),
                "api_key",
                API_KEY),
            List.of("file_size_mb"),
            tools::estimate),
        new ToolDefinition(
            "discovery_signup",
            "Create an account and receive an API key. The free tier is active immediately. No"
                + " authentication required.",
            properties(
                "email", property("string", "Email address for the new account."),
                "name", property("string", "Optional display name.")),
            List.of("email"),
            tools::signup),
        new ToolDefinition(
            "discovery_account",
            "Current plan, available credits and payment method status.",
            properties("api_key", API_KEY),
            List.of(),
            tools::account),
        new ToolDefinition(
            "discovery_list_plans",
            "List available plans with pricing and credit allowances. No authentication"
                + " required.",
            properties(),
            List.of(),
            tools::listPlans),
        new ToolDefinition(
            "discovery_subscribe",
            "Subscribe to or change plan: free_tier, tier_1 or tier_2. Paid plans need a payment"
                + " method on file.",
            properties(
                "plan",
                Map.of(
                    "type",
                    "string",
                    "enum",
                    List.of("free_tier", "tier_1", "tier_2"),
                    "description",
                    "Plan tier id."),
                "api_key",
                API_KEY),
            List.of("plan"),
            tools::subscribe),
        new ToolDefinition(
            "discovery_purchase_credits",
            "Buy credit packs of 20 credits each with the stored payment method.",
            properties(
                "packs", property("integer", "Number of 20-credit packs. Default 1."),
                "api_key", API_KEY),
            List.of(),
            tools::purchaseCredits),
        new ToolDefinition(
            "discovery_add_payment_method",
            "Attach a Stripe payment method (pm_...) tokenized through Stripe's own API. Card"
                + " details never reach Discovery Engine.",
            properties(
                "payment_method_id", property("string", "Stripe payment method id (pm_...)."),
                "api_key", API_KEY),
            List.of("payment_method_id"),
            tools::addPaymentMethod));
  }

  private static Map<String, Object> visibility() {
    return Map.of(
        "type",
        "string",
        "enum",
        List.of("public", "private"),
        "description",
        "public (free, results published) or private (costs credits). Default public.");
  }

  private static Map<String, Object> property(String type, String description) {
    return Map.of("type", type, "description", description);
  }

  private static Map<String, Object> properties(Object... nameAndSchema) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (int i = 0; i < nameAndSchema.length; i += 2) {
      result.put((String) nameAndSchema[i], nameAndSchema[i + 1]);
    }
    return result;
  }
}
