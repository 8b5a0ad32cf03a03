package com.example.mcpauth.service;

import com.example.mcpauth.adapter.store.KeyValueStore;
import com.example.mcpauth.adapter.store.StoreRecordMapper;
import com.example.mcpauth.domain.entity.AuthorizationSession;
import com.example.mcpauth.domain.entity.ClientRegistration;
import com.example.mcpauth.domain.entity.IdpProvider;
import com.example.mcpauth.domain.entity.IssuedToken;
import com.example.mcpauth.domain.entity.TokenGrant;
import com.example.mcpauth.domain.entity.TokenRequest;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.exception.EncryptionException;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.exception.StoreException;
import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.util.LogMasking;
import com.example.mcpauth.util.SecureTokens;
import com.nimbusds.oauth2.sdk.pkce.CodeChallenge;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Issues, exchanges and verifies downstream bearer tokens, keyed {@code mcp_token:<token>}.
 *
 * <p>The value minted at callback time is handed to the client as the authorization code and
 * returned unchanged as the access token by {@link #exchange(TokenRequest)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenService {

  public static final String TOKEN_KEY_PREFIX = "mcp_token:";
  public static final String TOKEN_VALUE_PREFIX = "mcp_";
  private static final int TOKEN_ENTROPY_BYTES = 32;

  private final KeyValueStore store;
  private final StoreRecordMapper recordMapper;
  private final EncryptionService encryptionService;
  private final ClientRegistrationService clientRegistrationService;
  private final ApplicationProperties properties;
  private final Clock clock;

  public IssuedToken mint(AuthorizationSession session, IdpProvider provider, UserPrincipal principal,
                          String upstreamRefreshToken) {
    IssuedToken token = new IssuedToken(
        TOKEN_VALUE_PREFIX + SecureTokens.generate(TOKEN_ENTROPY_BYTES),
        session.downstreamClientId(),
        provider,
        principal,
        upstreamRefreshToken,
        session.codeChallenge(),
        session.codeChallengeMethod(),
        session.scope(),
        clock.instant());

    store.put(TOKEN_KEY_PREFIX + token.tokenValue(), recordMapper.write(TokenRecord.from(token, encryptionService)),
              tokenTtl());
    log.info("Issued token {} to client {} for user {}", LogMasking.mask(token.tokenValue()),
             token.clientId(), principal.userId());
    return token;
  }

  /**
   * Authorization-code exchange. Repeating the call with the same code succeeds while the
   * token is live.
   */
  public TokenGrant exchange(TokenRequest request) {
    if (!ClientRegistrationService.GRANT_TYPE_AUTHORIZATION_CODE.equals(request.grantType())) {
      throw OAuth2Exception.invalidRequest("grant_type must be authorization_code");
    }
    if (isBlank(request.code()) || isBlank(request.clientId())) {
      throw OAuth2Exception.invalidRequest("code and client_id are required");
    }

    IssuedToken token = findLive(request.code())
        .orElseThrow(() -> OAuth2Exception.invalidGrant("Authorization code is invalid or expired"));

    if (token.clientId() != null && !token.clientId().equals(request.clientId())) {
      log.warn("Token {} presented by client {} but issued to {}", LogMasking.mask(token.tokenValue()),
               request.clientId(), token.clientId());
      throw OAuth2Exception.invalidGrant("Authorization code was issued to another client");
    }
    authenticateClient(request);
    verifyPkce(token, request.codeVerifier());

    return new TokenGrant(token.tokenValue(), TokenGrant.BEARER,
                          token.remainingSeconds(tokenTtl(), clock.instant()), token.scope());
  }

  /**
   * Resolves a bearer token to its issued record. A record that no longer decodes reads as
   * unauthenticated; a store that cannot be reached surfaces as {@link StoreException}.
   */
  public Optional<IssuedToken> verify(String tokenValue) {
    if (isBlank(tokenValue)) {
      return Optional.empty();
    }
    return findLive(tokenValue);
  }

  /**
   * At most one read, plus one delete when the record has outlived its TTL.
   */
  private Optional<IssuedToken> findLive(String tokenValue) {
    String key = TOKEN_KEY_PREFIX + tokenValue;
    Optional<String> json = store.get(key);
    if (json.isEmpty()) {
      return Optional.empty();
    }

    IssuedToken token;
    try {
      token = recordMapper.read(json.get(), TokenRecord.class).toIssuedToken(tokenValue, encryptionService);
    } catch (StoreException | EncryptionException e) {
      log.error("Unreadable record for token {}", LogMasking.mask(tokenValue), e);
      return Optional.empty();
    }
    if (token.isExpired(tokenTtl(), clock.instant())) {
      log.debug("Token {} expired, deleting", LogMasking.mask(tokenValue));
      store.delete(key);
      return Optional.empty();
    }
    return Optional.of(token);
  }

  private void authenticateClient(TokenRequest request) {
    if (request.clientSecret() == null) {
      return;
    }
    Optional<ClientRegistration> registration = clientRegistrationService.find(request.clientId());
    if (registration.isPresent() && !constantTimeEquals(registration.get().clientSecret(), request.clientSecret())) {
      log.warn("Client secret mismatch for client {}", request.clientId());
      throw OAuth2Exception.invalidClient("Client authentication failed");
    }
  }

  private static void verifyPkce(IssuedToken token, String codeVerifier) {
    if (token.codeChallenge() == null) {
      return;
    }
    if (isBlank(codeVerifier)) {
      throw OAuth2Exception.invalidGrant("code_verifier is required");
    }
    if (!pkceMatches(token.codeChallenge(), token.codeChallengeMethod(), codeVerifier)) {
      throw OAuth2Exception.invalidGrant("code_verifier does not match code_challenge");
    }
  }

  static boolean pkceMatches(String challenge, String method, String verifier) {
    if (CodeChallengeMethod.S256.getValue().equals(method)) {
      try {
        return CodeChallenge.compute(CodeChallengeMethod.S256, new CodeVerifier(verifier)).getValue().equals(challenge);
      } catch (IllegalArgumentException e) {
        return false;
      }
    }
    return constantTimeEquals(challenge, verifier);
  }

  private static boolean constantTimeEquals(String expected, String actual) {
    if (expected == null || actual == null) {
      return false;
    }
    return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
  }

  private Duration tokenTtl() {
    return properties.oauth().tokenTtl();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Stored form of an {@link IssuedToken}; upstream credentials are encrypted.
   */
  record TokenRecord(
      String clientId,
      IdpProvider provider,
      String userId,
      String displayName,
      String email,
      String encryptedAccessToken,
      String encryptedRefreshToken,
      String codeChallenge,
      String codeChallengeMethod,
      String scope,
      long createdAt
  ) {

    static TokenRecord from(IssuedToken token, EncryptionService encryption) {
      UserPrincipal principal = token.principal();
      return new TokenRecord(
          token.clientId(),
          token.provider(),
          principal.userId(),
          principal.displayName(),
          principal.email(),
          encryption.encryptNullable(principal.upstreamAccessToken()),
          encryption.encryptNullable(token.upstreamRefreshToken()),
          token.codeChallenge(),
          token.codeChallengeMethod(),
          token.scope(),
          token.createdAt().toEpochMilli());
    }

    IssuedToken toIssuedToken(String tokenValue, EncryptionService encryption) {
      UserPrincipal principal = new UserPrincipal(userId, displayName, email,
                                                  encryption.decryptNullable(encryptedAccessToken));
      return new IssuedToken(tokenValue, clientId, provider, principal,
                             encryption.decryptNullable(encryptedRefreshToken),
                             codeChallenge, codeChallengeMethod, scope, Instant.ofEpochMilli(createdAt));
    }
  }
}
