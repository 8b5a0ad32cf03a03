package com.example.mcpauth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.notNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mcpauth.TestProperties;
import com.example.mcpauth.adapter.idp.IdpClient;
import com.example.mcpauth.adapter.idp.IdpClientRegistry;
import com.example.mcpauth.domain.entity.AuthorizationRequest;
import com.example.mcpauth.domain.entity.AuthorizationSession;
import com.example.mcpauth.domain.entity.ClientRegistration;
import com.example.mcpauth.domain.entity.ConsentDetails;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.properties.ApplicationProperties;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationServiceTest {

  private static final String REDIRECT = "http://localhost:6274/oauth/callback";

  @Mock
  private AuthorizationSessionService sessionService;

  @Mock
  private ClientRegistrationService clientRegistrationService;

  @Mock
  private ApprovalCookieSigner approvalCookieSigner;

  @Mock
  private IdpClientRegistry idpClientRegistry;

  @Mock
  private IdpClient idpClient;

  @Test
  void validRequestIsAcceptedAsIs() {
    AuthorizationRequest request = service(TestProperties.defaults())
        .validate("client-1", REDIRECT, "code", "xyz", "challenge", "S256", "mcp:read");

    assertThat(request).isEqualTo(
        new AuthorizationRequest("client-1", REDIRECT, "code", "xyz", "challenge", "S256", "mcp:read"));
  }

  @Test
  void missingParametersAreRejected() {
    AuthorizationService service = service(TestProperties.defaults());

    assertThatThrownBy(() -> service.validate(null, REDIRECT, "code", "s", null, null, null))
        .isInstanceOfSatisfying(OAuth2Exception.class, e -> {
          assertThat(e.getErrorCode()).isEqualTo("invalid_request");
          assertThat(e.getMessage()).isEqualTo(
              "Missing required parameters: client_id, redirect_uri, response_type=code");
        });
    assertThatThrownBy(() -> service.validate("c", "", "code", "s", null, null, null))
        .isInstanceOf(OAuth2Exception.class);
    assertThatThrownBy(() -> service.validate("c", REDIRECT, "token", "s", null, null, null))
        .isInstanceOf(OAuth2Exception.class);
  }

  @Test
  void relativeRedirectUriIsRejected() {
    assertThatThrownBy(() -> service(TestProperties.defaults())
        .validate("c", "/cb", "code", "s", null, null, null))
        .isInstanceOfSatisfying(OAuth2Exception.class,
                                e -> assertThat(e.getErrorCode()).isEqualTo("invalid_request"));
  }

  @Test
  void missingStateIsGenerated() {
    AuthorizationRequest request = service(TestProperties.defaults())
        .validate("c", REDIRECT, "code", null, null, null, null);

    assertThat(request.state()).isNotBlank();
  }

  @Test
  void challengeMethodDefaultsToPlain() {
    AuthorizationRequest request = service(TestProperties.defaults())
        .validate("c", REDIRECT, "code", "s", "verifier-as-challenge", null, null);

    assertThat(request.codeChallengeMethod()).isEqualTo("plain");
  }

  @Test
  void unsupportedChallengeMethodIsRejected() {
    AuthorizationService service = service(TestProperties.defaults());

    assertThatThrownBy(() -> service.validate("c", REDIRECT, "code", "s", "x", "S512", null))
        .isInstanceOf(OAuth2Exception.class);
    assertThatThrownBy(() -> service.validate("c", REDIRECT, "code", "s", null, "S256", null))
        .isInstanceOf(OAuth2Exception.class);
  }

  @Test
  void unregisteredClientPassesWhenRegistrationNotRequired() {
    AuthorizationRequest request = service(TestProperties.defaults())
        .validate("unknown", REDIRECT, "code", "s", null, null, null);

    assertThat(request.clientId()).isEqualTo("unknown");
  }

  @Test
  void strictModeRejectsUnknownClientAndForeignRedirect() {
    AuthorizationService service = service(TestProperties.defaults().strictClients(true, true));
    when(clientRegistrationService.find("unknown")).thenReturn(Optional.empty());
    when(clientRegistrationService.find("known")).thenReturn(Optional.of(registration("known", "Known")));

    assertThatThrownBy(() -> service.validate("unknown", REDIRECT, "code", "s", null, null, null))
        .isInstanceOfSatisfying(OAuth2Exception.class,
                                e -> assertThat(e.getErrorCode()).isEqualTo("invalid_client"));
    assertThatThrownBy(() -> service.validate("known", "https://evil.example/cb", "code", "s", null, null, null))
        .isInstanceOfSatisfying(OAuth2Exception.class,
                                e -> assertThat(e.getErrorCode()).isEqualTo("invalid_request"));
    assertThat(service.validate("known", REDIRECT, "code", "s", null, null, null).clientId()).isEqualTo("known");
  }

  @Test
  void consentDetailsUseRegisteredNameAndSplitScopes() {
    when(clientRegistrationService.find("known")).thenReturn(Optional.of(registration("known", "Inspector")));
    AuthorizationRequest request =
        new AuthorizationRequest("known", REDIRECT, "code", "s", null, null, "mcp:read  mcp:write");

    ConsentDetails details = service(TestProperties.defaults()).consentDetails(request);

    assertThat(details.serverName()).isEqualTo("Test Gateway");
    assertThat(details.clientName()).isEqualTo("Inspector");
    assertThat(details.scopes()).containsExactly("mcp:read", "mcp:write");
  }

  @Test
  void consentDetailsFallBackToClientId() {
    when(clientRegistrationService.find("anon")).thenReturn(Optional.empty());

    ConsentDetails details = service(TestProperties.defaults())
        .consentDetails(new AuthorizationRequest("anon", REDIRECT, "code", "s", null, null, null));

    assertThat(details.clientName()).isEqualTo("anon");
    assertThat(details.scopes()).isEmpty();
  }

  @Test
  void upstreamAuthorizationCarriesSessionIdAsState() {
    AuthorizationRequest request = new AuthorizationRequest("c", REDIRECT, "code", "s", null, null, null);
    AuthorizationSession session = new AuthorizationSession("sid-1", "c", REDIRECT, "s", null, null, null,
                                                            "verifier", 0L);
    URI upstream = URI.create("https://accounts.google.com/o/oauth2/v2/auth?state=sid-1");
    when(sessionService.create(eq(request), notNull())).thenReturn(session);
    when(idpClientRegistry.active()).thenReturn(idpClient);
    when(idpClient.buildAuthorizationUri(eq("http://localhost:8080/callback"), eq("sid-1"), notNull()))
        .thenReturn(upstream);

    assertThat(service(TestProperties.defaults()).beginUpstreamAuthorization(request)).isEqualTo(upstream);
  }

  @Test
  void upstreamPkceCanBeDisabled() {
    AuthorizationRequest request = new AuthorizationRequest("c", REDIRECT, "code", "s", null, null, null);
    AuthorizationSession session = new AuthorizationSession("sid-1", "c", REDIRECT, "s", null, null, null, null, 0L);
    when(sessionService.create(eq(request), isNull())).thenReturn(session);
    when(idpClientRegistry.active()).thenReturn(idpClient);
    when(idpClient.buildAuthorizationUri(any(), eq("sid-1"), isNull())).thenReturn(URI.create("https://idp/auth"));

    service(TestProperties.defaults().pkceEnabled(false)).beginUpstreamAuthorization(request);

    verify(sessionService).create(request, null);
  }

  @Test
  void denialRedirectCarriesAccessDeniedAndState() {
    URI redirect = service(TestProperties.defaults()).denialRedirect(
        new AuthorizationRequest("c", "https://app.example/cb?x=1#top", "code", "st ate+1", null, null, null));

    assertThat(redirect.toString())
        .isEqualTo("https://app.example/cb?x=1&error=access_denied&state=st%20ate%2B1#top");
  }

  @Test
  void denialRedirectWithoutStateOmitsIt() {
    URI redirect = service(TestProperties.defaults()).denialRedirect(
        new AuthorizationRequest("c", "cursor://anysphere.cursor-mcp/oauth/callback", "code", null, null, null,
                                 null));

    assertThat(redirect.toString()).isEqualTo("cursor://anysphere.cursor-mcp/oauth/callback?error=access_denied");
  }

  private AuthorizationService service(TestProperties properties) {
    ApplicationProperties built = properties.build();
    return new AuthorizationService(sessionService, clientRegistrationService, approvalCookieSigner,
                                    idpClientRegistry, built);
  }

  private static ClientRegistration registration(String clientId, String name) {
    return new ClientRegistration(clientId, "secret", name, List.of(REDIRECT), List.of("authorization_code"),
                                  List.of("code"), "client_secret_post", null, 0L);
  }
}
