package com.leaplabs.discovery.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The account cannot pay for a private run. Carries the last known balance and the estimated cost
 * so the caller can buy credits or choose a public run explicitly.
 */
public class InsufficientCreditsException extends DiscoveryException {
  private final long balance;
  private final long estimatedCredits;

  public InsufficientCreditsException(long balance, long estimatedCredits) {
    super(
        DiscoveryErrorCode.RESOURCE_EXHAUSTED,
        "Insufficient credits: this private run needs %d credit(s) but the account has %d."
            .formatted(estimatedCredits, balance),
        context(balance, estimatedCredits));
    this.balance = balance;
    this.estimatedCredits = estimatedCredits;
  }

  public long getBalance() {
    return balance;
  }

  public long getEstimatedCredits() {
    return estimatedCredits;
  }

  private static Map<String, Object> context(long balance, long estimatedCredits) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("balance", balance);
    ctx.put("estimated_credits", estimatedCredits);
    return ctx;
  }
}
