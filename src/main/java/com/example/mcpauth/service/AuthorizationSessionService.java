package com.example.mcpauth.service;

import com.example.mcpauth.adapter.store.KeyValueStore;
import com.example.mcpauth.adapter.store.StoreRecordMapper;
import com.example.mcpauth.domain.entity.AuthorizationRequest;
import com.example.mcpauth.domain.entity.AuthorizationSession;
import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.util.LogMasking;
import com.example.mcpauth.util.SecureTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Pending authorization sessions, keyed {@code session:<id>}.
 * The session id doubles as the upstream {@code state}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationSessionService {

  public static final String SESSION_KEY_PREFIX = "session:";
  public static final String USED_SESSION_KEY_PREFIX = "used_session:";
  private static final int SESSION_ID_ENTROPY_BYTES = 32;

  private final KeyValueStore store;
  private final StoreRecordMapper recordMapper;
  private final ApplicationProperties properties;
  private final Clock clock;

  public AuthorizationSession create(AuthorizationRequest request, String upstreamCodeVerifier) {
    String sessionId = SecureTokens.generate(SESSION_ID_ENTROPY_BYTES);
    AuthorizationSession session = new AuthorizationSession(
        sessionId,
        request.clientId(),
        request.redirectUri(),
        request.state(),
        request.codeChallenge(),
        request.codeChallengeMethod(),
        request.scope(),
        upstreamCodeVerifier,
        clock.millis());

    store.put(SESSION_KEY_PREFIX + sessionId, recordMapper.write(session), properties.oauth().sessionTtl());
    log.debug("Created authorization session {} for client {}", LogMasking.mask(sessionId), request.clientId());
    return session;
  }

  public Optional<AuthorizationSession> find(String sessionId) {
    return store.get(SESSION_KEY_PREFIX + sessionId)
        .map(json -> recordMapper.read(json, AuthorizationSession.class));
  }

  /**
   * Marks the session spent and removes it so a {@code state} value cannot be replayed.
   * Of concurrent callbacks carrying the same {@code state}, exactly one gets {@code true}.
   */
  public boolean claim(String sessionId) {
    if (!store.putIfAbsent(USED_SESSION_KEY_PREFIX + sessionId, "1", properties.oauth().sessionTtl())) {
      log.warn("Session {} already claimed by another callback", LogMasking.mask(sessionId));
      return false;
    }
    store.delete(SESSION_KEY_PREFIX + sessionId);
    return true;
  }
}
