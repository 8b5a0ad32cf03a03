package com.example.mcpauth.domain.entity;

import java.util.List;

/**
 * Dynamically registered downstream client. Immutable once stored.
 */
public record ClientRegistration(
    String clientId,
    String clientSecret,
    String clientName,
    List<String> redirectUris,
    List<String> grantTypes,
    List<String> responseTypes,
    String tokenEndpointAuthMethod,
    String scope,
    long issuedAt
) {

  public boolean allowsRedirectUri(String redirectUri) {
    return redirectUris != null && redirectUris.contains(redirectUri);
  }
}
