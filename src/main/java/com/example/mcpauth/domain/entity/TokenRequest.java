package com.example.mcpauth.domain.entity;

/**
 * Form parameters of a downstream {@code /token} call.
 */
public record TokenRequest(
    String grantType,
    String code,
    String clientId,
    String clientSecret,
    String codeVerifier,
    String redirectUri
) {}
