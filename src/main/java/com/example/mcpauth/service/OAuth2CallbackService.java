package com.example.mcpauth.service;

import com.example.mcpauth.adapter.idp.IdpClient;
import com.example.mcpauth.adapter.idp.IdpClientRegistry;
import com.example.mcpauth.adapter.store.KeyValueStore;
import com.example.mcpauth.domain.entity.AuthorizationSession;
import com.example.mcpauth.domain.entity.IssuedToken;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.util.LogMasking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Upstream {@code /callback} leg: exchanges the upstream code, resolves the user, mints the
 * downstream token and sends the browser back to the client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OAuth2CallbackService {

  public static final String USED_CODE_KEY_PREFIX = "used_code:";

  private final AuthorizationSessionService sessionService;
  private final TokenService tokenService;
  private final IdpClientRegistry idpClientRegistry;
  private final AuthorizationService authorizationService;
  private final KeyValueStore store;
  private final ApplicationProperties properties;

  /**
   * @return the downstream redirect carrying the minted token as {@code code}
   */
  public URI handleCallback(String code, String state, String error, String errorDescription) {
    if (error != null && !error.isBlank()) {
      log.warn("Upstream authorization returned error {}: {}", error, errorDescription);
      String errorCode = OAuth2ErrorCodes.ACCESS_DENIED.equals(error)
          ? OAuth2ErrorCodes.ACCESS_DENIED
          : OAuth2ErrorCodes.INVALID_REQUEST;
      throw new OAuth2Exception(errorCode, "Upstream authorization failed", HttpStatus.BAD_REQUEST);
    }
    if (code == null || code.isBlank() || state == null || state.isBlank()) {
      throw OAuth2Exception.invalidRequest("Missing code or state");
    }

    AuthorizationSession session = sessionService.find(state)
        .orElseThrow(() -> {
          log.warn("Callback for unknown or expired session {}", LogMasking.mask(state));
          return OAuth2Exception.invalidSession("Invalid or expired session");
        });

    if (!sessionService.claim(state)) {
      throw OAuth2Exception.invalidSession("Invalid or expired session");
    }
    claimUpstreamCode(code);

    IdpClient idpClient = idpClientRegistry.active();
    IdpClient.TokenResponse upstreamTokens = idpClient.exchangeCodeForTokens(
        code, session.upstreamCodeVerifier(), authorizationService.callbackUri());
    UserPrincipal principal = idpClient.fetchUserPrincipal(upstreamTokens.accessToken());

    IssuedToken token = tokenService.mint(session, idpClient.provider(), principal, upstreamTokens.refreshToken());

    UriComponentsBuilder redirect = UriComponentsBuilder.fromUriString(session.downstreamRedirectUri())
        .queryParam("code", UriUtils.encode(token.tokenValue(), StandardCharsets.UTF_8));
    if (session.downstreamState() != null) {
      redirect.queryParam("state", UriUtils.encode(session.downstreamState(), StandardCharsets.UTF_8));
    }
    log.info("Callback complete for user {}, redirecting to client {}", principal.userId(),
             session.downstreamClientId());
    return redirect.build(true).toUri();
  }

  /**
   * Only the first callback presenting an upstream code may proceed to mint a token.
   */
  private void claimUpstreamCode(String code) {
    boolean claimed = store.putIfAbsent(USED_CODE_KEY_PREFIX + sha256(code), "1",
                                        properties.oauth().replayGuardTtl());
    if (!claimed) {
      log.warn("Upstream authorization code replayed");
      throw OAuth2Exception.invalidGrant("Authorization code already used");
    }
  }

  private static String sha256(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}
