package com.example.mcpauth.service;

import com.example.mcpauth.adapter.idp.IdpClientRegistry;
import com.example.mcpauth.domain.entity.AuthorizationRequest;
import com.example.mcpauth.domain.entity.AuthorizationSession;
import com.example.mcpauth.domain.entity.ClientRegistration;
import com.example.mcpauth.domain.entity.ConsentDetails;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.util.LogMasking;
import com.example.mcpauth.util.RedirectUris;
import com.example.mcpauth.util.SecureTokens;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Downstream {@code /authorize} leg: request validation, consent, and the hand-off to the
 * upstream provider.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthorizationService {

  public static final String CALLBACK_PATH = "/callback";
  private static final int GENERATED_STATE_BYTES = 16;
  private static final String METHOD_PLAIN = CodeChallengeMethod.PLAIN.getValue();
  private static final String METHOD_S256 = CodeChallengeMethod.S256.getValue();

  private final AuthorizationSessionService sessionService;
  private final ClientRegistrationService clientRegistrationService;
  private final ApprovalCookieSigner approvalCookieSigner;
  private final IdpClientRegistry idpClientRegistry;
  private final ApplicationProperties properties;

  /**
   * Validates raw authorize parameters. A missing {@code state} is generated, since some
   * clients omit it.
   */
  public AuthorizationRequest validate(String clientId, String redirectUri, String responseType, String state,
                                       String codeChallenge, String codeChallengeMethod, String scope) {
    if (isBlank(clientId) || isBlank(redirectUri) || !ClientRegistrationService.RESPONSE_TYPE_CODE.equals(responseType)) {
      throw OAuth2Exception.invalidRequest(
          "Missing required parameters: client_id, redirect_uri, response_type=code");
    }
    if (!RedirectUris.isAbsolute(redirectUri)) {
      throw OAuth2Exception.invalidRequest("redirect_uri must be an absolute URI");
    }

    String method = null;
    if (!isBlank(codeChallenge)) {
      method = isBlank(codeChallengeMethod) ? METHOD_PLAIN : codeChallengeMethod;
      if (!METHOD_PLAIN.equals(method) && !METHOD_S256.equals(method)) {
        throw OAuth2Exception.invalidRequest("Unsupported code_challenge_method: " + codeChallengeMethod);
      }
    } else if (!isBlank(codeChallengeMethod)) {
      throw OAuth2Exception.invalidRequest("code_challenge_method supplied without code_challenge");
    }

    enforceClientPolicy(clientId, redirectUri);

    String effectiveState = isBlank(state) ? SecureTokens.generate(GENERATED_STATE_BYTES) : state;
    if (isBlank(state)) {
      log.debug("Client {} sent no state, generated one", clientId);
    }
    return new AuthorizationRequest(clientId, redirectUri, responseType, effectiveState,
                                    isBlank(codeChallenge) ? null : codeChallenge, method,
                                    isBlank(scope) ? null : scope);
  }

  public boolean isApproved(HttpServletRequest request, String clientId) {
    return approvalCookieSigner.isApproved(request, clientId);
  }

  public void recordApproval(HttpServletRequest request, HttpServletResponse response, String clientId) {
    approvalCookieSigner.approve(request, response, clientId);
  }

  public ConsentDetails consentDetails(AuthorizationRequest request) {
    Optional<ClientRegistration> registration = clientRegistrationService.find(request.clientId());
    String clientName = registration.map(ClientRegistration::clientName)
        .filter(name -> !name.isBlank())
        .orElse(request.clientId());
    List<String> scopes = request.scope() == null
        ? List.of()
        : Arrays.stream(request.scope().split(" ")).filter(s -> !s.isBlank()).toList();
    return new ConsentDetails(properties.server().name(), clientName, request.clientId(),
                              request.redirectUri(), scopes, request);
  }

  /**
   * Persists a session for the request and returns the upstream authorization URL that
   * carries the session id as {@code state}.
   */
  public URI beginUpstreamAuthorization(AuthorizationRequest request) {
    String codeVerifier = properties.upstream().pkceEnabled() ? new CodeVerifier().getValue() : null;
    AuthorizationSession session = sessionService.create(request, codeVerifier);
    URI upstream = idpClientRegistry.active()
        .buildAuthorizationUri(callbackUri(), session.sessionId(), codeVerifier);
    log.info("Redirecting client {} upstream, session {}", request.clientId(), LogMasking.mask(session.sessionId()));
    return upstream;
  }

  public URI denialRedirect(AuthorizationRequest request) {
    log.info("User denied access for client {}", request.clientId());
    UriComponentsBuilder redirect = UriComponentsBuilder.fromUriString(request.redirectUri())
        .queryParam("error", OAuth2ErrorCodes.ACCESS_DENIED);
    if (request.state() != null) {
      redirect.queryParam("state", UriUtils.encode(request.state(), StandardCharsets.UTF_8));
    }
    return redirect.build(true).toUri();
  }

  public String callbackUri() {
    return properties.server().baseUrl() + CALLBACK_PATH;
  }

  private void enforceClientPolicy(String clientId, String redirectUri) {
    ApplicationProperties.OAuthProperties oauth = properties.oauth();
    if (!oauth.requireRegisteredClient()) {
      return;
    }
    ClientRegistration registration = clientRegistrationService.find(clientId)
        .orElseThrow(() -> OAuth2Exception.invalidClient("Unknown client_id"));
    if (oauth.enforceRedirectUriMatch() && !registration.allowsRedirectUri(redirectUri)) {
      throw OAuth2Exception.invalidRequest("redirect_uri is not registered for this client");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
