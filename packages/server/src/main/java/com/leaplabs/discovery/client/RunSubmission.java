package com.leaplabs.discovery.client;

import com.leaplabs.discovery.estimate.Visibility;
import java.util.Map;

/** Everything the create-run endpoint needs, including the idempotency token for this attempt. */
public record RunSubmission(
    UploadedDataset dataset,
    String targetColumn,
    int depth,
    Visibility visibility,
    String title,
    String description,
    Map<String, String> columnDescriptions,
    String idempotencyKey) {}
