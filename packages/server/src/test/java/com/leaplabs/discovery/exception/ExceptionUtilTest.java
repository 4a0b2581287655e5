package com.leaplabs.discovery.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.leaplabs.discovery.utility.JacksonUtility;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void discoveryExceptionKeepsCodeAndContext() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(new InsufficientCreditsException(3, 8));

    assertEquals(DiscoveryErrorCode.RESOURCE_EXHAUSTED, details.code);
    assertEquals("InsufficientCreditsException", details.type);
    assertEquals(3L, details.context.get("balance"));
    assertEquals(8L, details.context.get("estimated_credits"));
  }

  @Test
  void foreignExceptionsAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(DiscoveryErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
    assertNull(details.context);
  }

  @Test
  void serialisedFormUsesErrorCodeTypeContext() {
    JsonNode json =
        JacksonUtility.readTree(
            JacksonUtility.toJson(
                ExceptionUtil.toErrorDetails(new JobNotFoundException("run-9"))));
    assertEquals("Run not found: run-9", json.path("error").asText());
    assertEquals("NOT_FOUND", json.path("code").asText());
    assertEquals("JobNotFoundException", json.path("type").asText());
    assertEquals("run-9", json.path("context").path("run_id").asText());
    assertTrue(json.path("timestamp").isTextual());
  }

  @Test
  void rethrowKeepsDiscoveryExceptions() {
    ValidationException original = new ValidationException("bad");
    assertSame(
        original,
        ExceptionUtil.rethrowIfUnchecked(original, e -> new IoException("wrapped", e)));
    assertInstanceOf(
        IoException.class,
        ExceptionUtil.rethrowIfUnchecked(new Exception("x"), e -> new IoException("wrapped", e)));
  }
}
