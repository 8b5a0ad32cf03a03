package com.example.mcpauth.web.rest.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.mcpauth.domain.entity.AuthorizationRequest;
import com.example.mcpauth.domain.entity.ClientRegistration;
import com.example.mcpauth.domain.entity.TokenGrant;
import com.example.mcpauth.domain.entity.TokenRequest;
import com.example.mcpauth.exception.OAuth2Exception;
import com.example.mcpauth.exception.UpstreamIdentityException;
import com.example.mcpauth.service.AuthorizationService;
import com.example.mcpauth.service.ClientRegistrationService;
import com.example.mcpauth.service.OAuth2CallbackService;
import com.example.mcpauth.service.TokenService;
import com.example.mcpauth.web.view.ConsentPageRenderer;
import java.net.URI;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = OAuthController.class)
@AutoConfigureMockMvc(addFilters = false)
@ActiveProfiles("test")
class OAuthControllerTest {

  private static final AuthorizationRequest REQUEST =
      new AuthorizationRequest("c1", "http://localhost/cb", "code", "s1", null, null, null);

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private AuthorizationService authorizationService;

  @MockitoBean
  private OAuth2CallbackService callbackService;

  @MockitoBean
  private TokenService tokenService;

  @MockitoBean
  private ClientRegistrationService clientRegistrationService;

  @MockitoBean
  private ConsentPageRenderer consentPageRenderer;

  @Test
  void jsonConsentSubmissionIsHandledLikeTheForm() throws Exception {
    when(authorizationService.validate("c1", "http://localhost/cb", "code", "s1", null, null, null))
        .thenReturn(REQUEST);
    when(authorizationService.denialRedirect(REQUEST))
        .thenReturn(URI.create("http://localhost/cb?error=access_denied&state=s1"));

    mockMvc.perform(post("/authorize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"client_id\":\"c1\",\"redirect_uri\":\"http://localhost/cb\","
                                     + "\"response_type\":\"code\",\"state\":\"s1\",\"action\":\"deny\"}"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "http://localhost/cb?error=access_denied&state=s1"));
  }

  @Test
  void unknownActionIsInvalidRequest() throws Exception {
    when(authorizationService.validate("c1", "http://localhost/cb", "code", "s1", null, null, null))
        .thenReturn(REQUEST);

    mockMvc.perform(post("/authorize")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("client_id", "c1")
                        .param("redirect_uri", "http://localhost/cb")
                        .param("response_type", "code")
                        .param("state", "s1")
                        .param("action", "maybe"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
  }

  @Test
  void callbackUpstreamExchangeFailureIsBadGateway() throws Exception {
    when(callbackService.handleCallback("code", "state", null, null))
        .thenThrow(new UpstreamIdentityException(UpstreamIdentityException.Phase.TOKEN_EXCHANGE, 401,
                                                 "invalid_client", "{\"error\":\"invalid_client\"}",
                                                 "GOOGLE token exchange failed with status 401"));

    mockMvc.perform(get("/callback").param("code", "code").param("state", "state"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("upstream_error"))
        .andExpect(jsonPath("$.error_description").value("GOOGLE token exchange failed with status 401"));
  }

  @Test
  void callbackProfileFailureIsServerError() throws Exception {
    when(callbackService.handleCallback("code", "state", null, null))
        .thenThrow(new UpstreamIdentityException(UpstreamIdentityException.Phase.PROFILE, 500, null, "",
                                                 "Failed to fetch user info from GOOGLE"));

    mockMvc.perform(get("/callback").param("code", "code").param("state", "state"))
        .andExpect(status().isInternalServerError());
  }

  @Test
  void tokenResponseIsNotCacheable() throws Exception {
    when(tokenService.exchange(any(TokenRequest.class)))
        .thenReturn(new TokenGrant("mcp_abc", "Bearer", 600, null));

    mockMvc.perform(post("/token")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("grant_type", "authorization_code")
                        .param("code", "mcp_abc")
                        .param("client_id", "c1"))
        .andExpect(status().isOk())
        .andExpect(header().string("Cache-Control", "no-store"))
        .andExpect(header().string("Pragma", "no-cache"))
        .andExpect(jsonPath("$.access_token").value("mcp_abc"))
        .andExpect(jsonPath("$.expires_in").value(600))
        .andExpect(jsonPath("$.scope").doesNotExist());
    verify(tokenService).exchange(new TokenRequest("authorization_code", "mcp_abc", "c1", null, null, null));
  }

  @Test
  void invalidClientIsUnauthorized() throws Exception {
    when(tokenService.exchange(any(TokenRequest.class)))
        .thenThrow(OAuth2Exception.invalidClient("Client authentication failed"));

    mockMvc.perform(post("/token")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("grant_type", "authorization_code")
                        .param("code", "mcp_abc")
                        .param("client_id", "c1")
                        .param("client_secret", "wrong"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_client"));
  }

  @Test
  void registrationResponseFollowsDynamicRegistrationFormat() throws Exception {
    when(clientRegistrationService.register("Inspector", List.of("http://localhost/cb"), null))
        .thenReturn(new ClientRegistration("id-1", "secret-1", "Inspector", List.of("http://localhost/cb"),
                                           List.of("authorization_code"), List.of("code"), "client_secret_post",
                                           null, 1_700_000_000L));

    mockMvc.perform(post("/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"redirect_uris\":[\"http://localhost/cb\"],\"client_name\":\"Inspector\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.client_id").value("id-1"))
        .andExpect(jsonPath("$.client_secret").value("secret-1"))
        .andExpect(jsonPath("$.client_id_issued_at").value(1_700_000_000L))
        .andExpect(jsonPath("$.redirect_uris[0]").value("http://localhost/cb"))
        .andExpect(jsonPath("$.scope").doesNotExist());
  }

  @Test
  void malformedRegistrationBodyIsInvalidRequest() throws Exception {
    mockMvc.perform(post("/register").contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
  }
}
