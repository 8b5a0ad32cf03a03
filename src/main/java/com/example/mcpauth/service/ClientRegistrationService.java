package com.example.mcpauth.service;

import com.example.mcpauth.adapter.store.KeyValueStore;
import com.example.mcpauth.adapter.store.StoreRecordMapper;
import com.example.mcpauth.domain.entity.ClientRegistration;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.util.RedirectUris;
import com.example.mcpauth.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Dynamic client registration. Every well-formed request is accepted; redirect URIs are
 * not checked for uniqueness.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClientRegistrationService {

  public static final String CLIENT_KEY_PREFIX = "client:";
  public static final String GRANT_TYPE_AUTHORIZATION_CODE = "authorization_code";
  public static final String RESPONSE_TYPE_CODE = "code";
  public static final String AUTH_METHOD_CLIENT_SECRET_POST = "client_secret_post";
  private static final int CLIENT_SECRET_ENTROPY_BYTES = 32;

  private final KeyValueStore store;
  private final StoreRecordMapper recordMapper;
  private final ApplicationProperties properties;
  private final Clock clock;

  public ClientRegistration register(String clientName, List<String> redirectUris, String scope) {
    if (redirectUris == null || redirectUris.isEmpty()) {
      throw OAuth2Exception.invalidRequest("redirect_uris is required");
    }
    for (String redirectUri : redirectUris) {
      if (!RedirectUris.isAbsolute(redirectUri)) {
        throw OAuth2Exception.invalidRequest("redirect_uris must be absolute URIs: " + redirectUri);
      }
    }

    ClientRegistration registration = new ClientRegistration(
        UUID.randomUUID().toString(),
        SecureTokens.generate(CLIENT_SECRET_ENTROPY_BYTES),
        clientName,
        List.copyOf(redirectUris),
        List.of(GRANT_TYPE_AUTHORIZATION_CODE),
        List.of(RESPONSE_TYPE_CODE),
        AUTH_METHOD_CLIENT_SECRET_POST,
        scope,
        clock.instant().getEpochSecond());

    store.put(CLIENT_KEY_PREFIX + registration.clientId(), recordMapper.write(registration),
              properties.oauth().clientTtl());
    log.info("Registered client {} ({}) with {} redirect URI(s)",
             registration.clientId(), clientName, redirectUris.size());
    return registration;
  }

  public Optional<ClientRegistration> find(String clientId) {
    if (clientId == null || clientId.isBlank()) {
      return Optional.empty();
    }
    return store.get(CLIENT_KEY_PREFIX + clientId)
        .map(json -> recordMapper.read(json, ClientRegistration.class));
  }
}
