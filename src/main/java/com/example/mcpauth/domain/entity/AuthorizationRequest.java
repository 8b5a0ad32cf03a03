package com.example.mcpauth.domain.entity;

/**
 * Validated downstream {@code /authorize} parameters.
 */
public record AuthorizationRequest(
    String clientId,
    String redirectUri,
    String responseType,
    String state,
    String codeChallenge,
    String codeChallengeMethod,
    String scope
) {}
