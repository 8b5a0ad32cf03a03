package com.example.mcpauth.domain.entity;

/**
 * Pending downstream authorization, correlated with the upstream leg by {@code sessionId}
 * (sent upstream as {@code state}). Consumed once by the callback.
 */
public record AuthorizationSession(
    String sessionId,
    String downstreamClientId,
    String downstreamRedirectUri,
    String downstreamState,
    String codeChallenge,
    String codeChallengeMethod,
    String scope,
    String upstreamCodeVerifier,
    long createdAt
) {}
