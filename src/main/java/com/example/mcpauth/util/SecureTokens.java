package com.example.mcpauth.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Unguessable identifiers for sessions, tokens and client secrets.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SecureTokens {

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  /**
   * @return {@code byteCount} random bytes, base64url encoded without padding
   */
  public static String generate(int byteCount) {
    byte[] bytes = new byte[byteCount];
    SECURE_RANDOM.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }
}
