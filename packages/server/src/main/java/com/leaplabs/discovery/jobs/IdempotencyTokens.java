package com.leaplabs.discovery.jobs;

import com.leaplabs.discovery.exception.IoException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives submission tokens from request content plus a caller nonce. The same content and nonce
 * always give the same token, so a retried submission is recognised; a different nonce marks a
 * new logical submission of identical content. The dataset contributes its bytes, not its path,
 * so an edited file is new content and a copied one is not.
 */
public final class IdempotencyTokens {
  private static final String PREFIX = "disco-";

  private IdempotencyTokens() {}

  public static String derive(AnalysisRequest request, DatasetFile dataset, String nonce) {
    StringBuilder canonical = new StringBuilder();
    field(canonical, "dataset", contentHash(dataset.path()));
    field(canonical, "target", request.targetColumn().trim());
    field(canonical, "depth", Integer.toString(request.depth()));
    field(canonical, "visibility", request.visibility().wireName());
    field(canonical, "title", request.title());
    field(canonical, "description", request.description());
    for (Map.Entry<String, String> e : new TreeMap<>(request.columnDescriptions()).entrySet()) {
      field(canonical, "column:" + e.getKey(), e.getValue());
    }
    field(canonical, "nonce", nonce);
    return PREFIX + sha256(canonical.toString());
  }

  private static void field(StringBuilder sb, String name, String value) {
    // Length prefixes keep "ab"+"c" and "a"+"bc" apart.
    String v = value == null ? "" : value;
    sb.append(name).append('=').append(v.length()).append(':').append(v).append('\n');
  }

  private static String contentHash(Path file) {
    MessageDigest digest = sha256();
    byte[] buffer = new byte[64 * 1024];
    try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
      while (in.read(buffer) != -1) {
        // DigestInputStream updates the digest as it reads.
      }
    } catch (IOException e) {
      throw new IoException("Cannot read dataset file " + file, e);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static String sha256(String input) {
    return HexFormat.of().formatHex(sha256().digest(input.getBytes(StandardCharsets.UTF_8)));
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
