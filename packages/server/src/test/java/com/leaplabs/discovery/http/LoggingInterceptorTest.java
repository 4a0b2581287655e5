package com.leaplabs.discovery.http;

import static org.junit.jupiter.api.Assertions.*;

import okhttp3.Headers;
import org.junit.jupiter.api.Test;

class LoggingInterceptorTest {

  @Test
  void authorizationHeaderIsRedacted() {
    Headers headers =
        Headers.of("Authorization", "Bearer disco_secret", "X-Client-Type", "mcp");

    Headers redacted = LoggingInterceptor.redact(headers);

    assertEquals(LoggingInterceptor.REDACTED, redacted.get("Authorization"));
    assertEquals("mcp", redacted.get("X-Client-Type"));
    assertFalse(redacted.toString().contains("disco_secret"));
  }

  @Test
  void headersWithoutCredentialsAreUntouched() {
    Headers headers = Headers.of("Accept", "application/json");
    assertSame(headers, LoggingInterceptor.redact(headers));
  }
}
