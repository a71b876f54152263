package io.buildflow.backend.session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

final class SessionTokens {

  private SessionTokens() {}

  /** Lowercase hex SHA-256 of the token. */
  static String hash(String token) {
    if (token == null || token.isEmpty()) {
      throw new IllegalArgumentException("token is required");
    }
    try {
      var digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
