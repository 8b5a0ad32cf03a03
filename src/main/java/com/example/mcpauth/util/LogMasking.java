package com.example.mcpauth.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Shortens secrets before they reach a log line.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class LogMasking {

  private static final int VISIBLE_CHARS = 8;

  public static String mask(String secret) {
    if (secret == null) {
      return "null";
    }
    if (secret.length() <= VISIBLE_CHARS) {
      return "***";
    }
    return secret.substring(0, VISIBLE_CHARS) + "...";
  }
}
