package com.example.mcpauth.domain.entity;

import java.util.List;

/**
 * What the consent page shows the user before the downstream client is approved.
 */
public record ConsentDetails(
    String serverName,
    String clientName,
    String clientId,
    String redirectUri,
    List<String> scopes,
    AuthorizationRequest request
) {}
