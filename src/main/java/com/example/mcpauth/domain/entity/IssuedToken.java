package com.example.mcpauth.domain.entity;

import java.time.Duration;
import java.time.Instant;

/**
 * Opaque downstream token minted after a successful upstream exchange.
 * The same value serves as the authorization code and the bearer access token.
 */
public record IssuedToken(
    String tokenValue,
    String clientId,
    IdpProvider provider,
    UserPrincipal principal,
    String upstreamRefreshToken,
    String codeChallenge,
    String codeChallengeMethod,
    String scope,
    Instant createdAt
) {

  public String upstreamAccessToken() {
    return principal.upstreamAccessToken();
  }

  public Instant expiresAt(Duration ttl) {
    return createdAt.plus(ttl);
  }

  public boolean isExpired(Duration ttl, Instant now) {
    return expiresAt(ttl).isBefore(now);
  }

  /**
   * Seconds left before {@link #expiresAt(Duration)}, never negative.
   */
  public long remainingSeconds(Duration ttl, Instant now) {
    Duration remaining = Duration.between(now, expiresAt(ttl));
    return remaining.isNegative() ? 0 : remaining.getSeconds();
  }
}
