package com.example.mcpauth.adapter.idp;

import com.example.mcpauth.domain.entity.IdpProvider;
import com.example.mcpauth.domain.entity.UserPrincipal;

import java.net.URI;

/**
 * Interface for upstream identity provider clients.
 * Handles protocol-specific operations; failures surface as
 * {@link com.example.mcpauth.exception.UpstreamIdentityException}.
 */
public interface IdpClient {

  IdpProvider provider();

  /**
   * Builds the provider's authorization URL for the browser redirect.
   *
   * @param codeVerifier upstream PKCE verifier, or {@code null} when upstream PKCE is off
   */
  URI buildAuthorizationUri(String redirectUri, String state, String codeVerifier);

  /**
   * Exchanges an upstream authorization code for tokens.
   */
  TokenResponse exchangeCodeForTokens(String code, String codeVerifier, String redirectUri);

  /**
   * Resolves the user profile behind an upstream access token.
   */
  UserPrincipal fetchUserPrincipal(String accessToken);

  /**
   * Token response from the IdP.
   */
  record TokenResponse(
      String accessToken,
      String refreshToken,
      String scope,
      long expiresIn
  ) {}
}
