package com.leaplabs.discovery.account;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Last known account state. Advisory only: the service is the source of truth and the snapshot is
 * stale the moment any mutating call goes out.
 */
public record AccountSnapshot(
    @JsonProperty("credits") long credits,
    @JsonProperty("plan") String plan,
    @JsonProperty("has_payment_method") boolean hasPaymentMethod,
    @JsonProperty("usage") JsonNode usage,
    @JsonProperty("fetched_at") Instant fetchedAt,
    @JsonIgnore JsonNode raw) {

  /**
   * Read the account document. Credits come from the first of {@code available_credits}, {@code
   * credits_available}, {@code credits.total}, {@code credits.available}, a numeric {@code
   * credits}, or the sum of {@code subscription_credits} and {@code purchased_credits}.
   */
  public static AccountSnapshot fromJson(JsonNode account, Instant fetchedAt) {
    return new AccountSnapshot(
        credits(account),
        plan(account),
        paymentMethod(account),
        account.has("usage") ? account.get("usage") : null,
        fetchedAt,
        account);
  }

  private static long credits(JsonNode account) {
    for (String field : new String[] {"available_credits", "credits_available"}) {
      if (account.path(field).isNumber()) return account.path(field).asLong();
    }
    JsonNode credits = account.path("credits");
    if (credits.isNumber()) return credits.asLong();
    if (credits.isObject()) {
      for (String field : new String[] {"total", "available", "remaining"}) {
        if (credits.path(field).isNumber()) return credits.path(field).asLong();
      }
      if (credits.has("subscription") || credits.has("purchased")) {
        return credits.path("subscription").asLong(0) + credits.path("purchased").asLong(0);
      }
    }
    return account.path("subscription_credits").asLong(0)
        + account.path("purchased_credits").asLong(0);
  }

  private static String plan(JsonNode account) {
    JsonNode plan = account.path("plan");
    if (plan.isTextual()) return plan.asText();
    if (plan.isObject()) {
      for (String field : new String[] {"tier", "id", "name"}) {
        if (plan.path(field).isTextual()) return plan.path(field).asText();
      }
    }
    return account.path("plan_tier").asText(null);
  }

  private static boolean paymentMethod(JsonNode account) {
    if (account.path("has_payment_method").isBoolean()) {
      return account.path("has_payment_method").asBoolean();
    }
    JsonNode pm = account.path("payment_method");
    return !pm.isMissingNode() && !pm.isNull() && !(pm.isBoolean() && !pm.asBoolean());
  }
}
