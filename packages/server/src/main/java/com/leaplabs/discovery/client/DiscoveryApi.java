package com.leaplabs.discovery.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;

/**
 * Request/response contract of the remote Discovery service.
 *
 * <p>Implementations own authentication headers, transient-failure retries and the mapping of HTTP
 * outcomes onto {@link com.leaplabs.discovery.exception.DiscoveryException} subtypes. Methods that
 * take an {@code apiKey} send it as a bearer token.
 */
public interface DiscoveryApi {

  JsonNode listPlans();

  JsonNode signup(String email, String name);

  JsonNode account(String apiKey);

  JsonNode addPaymentMethod(String apiKey, String paymentMethodId);

  JsonNode purchaseCredits(String apiKey, int packs);

  JsonNode subscribe(String apiKey, String plan);

  /** Presign, upload and finalize a dataset file. Nothing is billed by this step. */
  UploadedDataset uploadDataset(String apiKey, Path file, DatasetFormat format);

  /**
   * Create a run. Safe to retry with the same {@link RunSubmission#idempotencyKey()}: a duplicate
   * token yields the already accepted run with {@link CreateRunResult#duplicate()} set.
   */
  CreateRunResult createRun(String apiKey, RunSubmission submission);

  /**
   * @throws com.leaplabs.discovery.exception.JobNotFoundException if the service does not know
   *     the run
   */
  RemoteRunStatus runStatus(String apiKey, String runId);

  /** Full result document of a run, returned verbatim. */
  JsonNode runResults(String apiKey, String runId);
}
