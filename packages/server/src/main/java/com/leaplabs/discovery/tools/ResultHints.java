package com.leaplabs.discovery.tools;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** Follow-up suggestions shown next to a completed run's results. */
final class ResultHints {
  static final String ACCOUNT_URL = "https://disco.leap-labs.com/account";

  private ResultHints() {}

  static List<String> forResults(JsonNode results) {
    List<String> hints = new ArrayList<>();

    long hiddenDeep = results.path("hidden_deep_count").asLong(0);
    long hiddenDeepNovel = results.path("hidden_deep_novel_count").asLong(0);
    if (hiddenDeep > 0) {
      String novelPart = hiddenDeepNovel > 0 ? ", including " + hiddenDeepNovel + " novel" : "";
      hints.add(
          "Deep analysis found %d more pattern%s%s. Upgrade to a paid plan to unlock them: %s"
              .formatted(hiddenDeep, hiddenDeep == 1 ? "" : "s", novelPart, ACCOUNT_URL));
    }

    if (results.path("is_public").asBoolean(true)) {
      hints.add(
          "This was a public run, results are visible in the public gallery. "
              + "Use visibility='private' for confidential data.");
    }
    return hints;
  }
}
