package com.example.mcpauth.domain.entity;

/**
 * Successful {@code /token} outcome.
 */
public record TokenGrant(
    String accessToken,
    String tokenType,
    long expiresIn,
    String scope
) {
  public static final String BEARER = "Bearer";
}
