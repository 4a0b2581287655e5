package com.leaplabs.discovery.estimate;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Projected credit cost of one run. Derived on demand, never cached. */
public record CostEstimate(
    @JsonProperty("file_size_mb") double fileSizeMb,
    @JsonProperty("depth") int depth,
    @JsonProperty("visibility") Visibility visibility,
    @JsonProperty("credits") long credits) {

  public boolean isFree() {
    return credits == 0;
  }
}
