package com.leaplabs.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A dataset the service has stored and profiled. {@code columns} is the service's own column
 * profile, forwarded untouched when the run is created.
 */
public record UploadedDataset(
    String key, String name, long size, String fileHash, JsonNode columns) {

  public int columnCount() {
    return columns != null && columns.isArray() ? columns.size() : 0;
  }
}
