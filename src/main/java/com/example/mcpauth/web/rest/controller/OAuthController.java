package com.example.mcpauth.web.rest.controller;

import com.example.mcpauth.domain.entity.AuthorizationRequest;
import com.example.mcpauth.domain.entity.ClientRegistration;
import com.example.mcpauth.domain.entity.TokenRequest;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.service.AuthorizationService;
import com.example.mcpauth.service.ClientRegistrationService;
import com.example.mcpauth.service.OAuth2CallbackService;
import com.example.mcpauth.service.TokenService;
import com.example.mcpauth.web.rest.dto.AuthorizeRequestBody;
import com.example.mcpauth.web.rest.dto.ClientRegistrationRequest;
import com.example.mcpauth.web.rest.dto.ClientRegistrationResponse;
import com.example.mcpauth.web.rest.dto.TokenResponse;
import com.example.mcpauth.web.view.ConsentPageRenderer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

/**
 * REST controller for the downstream authorization server endpoints.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class OAuthController implements OAuthAPI {

  private final AuthorizationService authorizationService;
  private final OAuth2CallbackService callbackService;
  private final TokenService tokenService;
  private final ClientRegistrationService clientRegistrationService;
  private final ConsentPageRenderer consentPageRenderer;

  @Override
  public ResponseEntity<String> authorize(String clientId, String redirectUri, String responseType, String state,
                                          String codeChallenge, String codeChallengeMethod, String scope,
                                          HttpServletRequest request) {
    AuthorizationRequest authorizationRequest = authorizationService.validate(
        clientId, redirectUri, responseType, state, codeChallenge, codeChallengeMethod, scope);
    return consentOrRedirect(authorizationRequest, request);
  }

  @Override
  public ResponseEntity<String> submitAuthorization(String clientId, String redirectUri, String responseType,
                                                    String state, String codeChallenge, String codeChallengeMethod,
                                                    String scope, String action, HttpServletRequest request,
                                                    HttpServletResponse response) {
    AuthorizationRequest authorizationRequest = authorizationService.validate(
        clientId, redirectUri, responseType, state, codeChallenge, codeChallengeMethod, scope);

    if (action == null || action.isBlank()) {
      return consentOrRedirect(authorizationRequest, request);
    }
    return switch (action) {
      case ConsentPageRenderer.ACTION_APPROVE -> {
        authorizationService.recordApproval(request, response, authorizationRequest.clientId());
        yield redirect(authorizationService.beginUpstreamAuthorization(authorizationRequest));
      }
      case ConsentPageRenderer.ACTION_DENY -> redirect(authorizationService.denialRedirect(authorizationRequest));
      default -> throw OAuth2Exception.invalidRequest("action must be approve or deny");
    };
  }

  @Override
  public ResponseEntity<String> submitAuthorizationJson(AuthorizeRequestBody body, HttpServletRequest request,
                                                        HttpServletResponse response) {
    if (body == null) {
      throw OAuth2Exception.invalidRequest("Request body is required");
    }
    return submitAuthorization(body.clientId(), body.redirectUri(), body.responseType(), body.state(),
                               body.codeChallenge(), body.codeChallengeMethod(), body.scope(), body.action(),
                               request, response);
  }

  @Override
  public ResponseEntity<Void> callback(String code, String state, String error, String errorDescription) {
    URI redirect = callbackService.handleCallback(code, state, error, errorDescription);
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(redirect)
        .build();
  }

  @Override
  public ResponseEntity<TokenResponse> token(String grantType, String code, String clientId, String clientSecret,
                                             String codeVerifier, String redirectUri) {
    TokenRequest tokenRequest = new TokenRequest(grantType, code, clientId, clientSecret, codeVerifier, redirectUri);
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .header(HttpHeaders.PRAGMA, "no-cache")
        .body(TokenResponse.from(tokenService.exchange(tokenRequest)));
  }

  @Override
  public ResponseEntity<ClientRegistrationResponse> register(ClientRegistrationRequest registrationRequest) {
    if (registrationRequest == null) {
      throw OAuth2Exception.invalidRequest("Invalid registration request");
    }
    ClientRegistration registration = clientRegistrationService.register(
        registrationRequest.clientName(), registrationRequest.redirectUris(), registrationRequest.scope());
    return ResponseEntity.status(HttpStatus.CREATED)
        .cacheControl(CacheControl.noStore())
        .body(ClientRegistrationResponse.from(registration));
  }

  private ResponseEntity<String> consentOrRedirect(AuthorizationRequest authorizationRequest,
                                                   HttpServletRequest request) {
    if (authorizationService.isApproved(request, authorizationRequest.clientId())) {
      log.debug("Client {} already approved, skipping consent", authorizationRequest.clientId());
      return redirect(authorizationService.beginUpstreamAuthorization(authorizationRequest));
    }
    String page = consentPageRenderer.render(authorizationService.consentDetails(authorizationRequest));
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_HTML)
        .body(page);
  }

  private static ResponseEntity<String> redirect(URI location) {
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(location)
        .build();
  }
}
