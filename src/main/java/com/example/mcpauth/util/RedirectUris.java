package com.example.mcpauth.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.net.URI;
import java.net.URISyntaxException;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class RedirectUris {

  /**
   * Client redirect URIs must be absolute; custom schemes such as {@code cursor://} are allowed.
   */
  public static boolean isAbsolute(String uri) {
    if (uri == null || uri.isBlank()) {
      return false;
    }
    try {
      return new URI(uri).isAbsolute();
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
