package com.example.mcpauth.adapter.idp;

import com.example.mcpauth.domain.entity.IdpProvider;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.exception.UpstreamIdentityException;
import com.example.mcpauth.exception.UpstreamIdentityException.Phase;
import com.example.mcpauth.properties.ApplicationProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Google OAuth 2.0 client: token endpoint plus the v2 userinfo endpoint.
 */
@Slf4j
@Component
public class GoogleIdentityClient extends AbstractHttpIdpClient {

  private final ApplicationProperties.UpstreamProperties.GoogleProperties google;

  public GoogleIdentityClient(ApplicationProperties properties, OkHttpClient upstreamOkHttpClient,
                              ObjectMapper objectMapper) {
    super(upstreamOkHttpClient, objectMapper);
    this.google = properties.upstream().google();
  }

  @Override
  public IdpProvider provider() {
    return IdpProvider.GOOGLE;
  }

  @Override
  protected String clientId() {
    return google.clientId();
  }

  @Override
  protected String authorizationUri() {
    return google.authorizationUri();
  }

  @Override
  protected String scope() {
    return google.scope();
  }

  @Override
  protected Map<String, String> extraAuthorizationParameters() {
    String hostedDomain = google.hostedDomain();
    return hostedDomain == null || hostedDomain.isBlank() ? Map.of() : Map.of("hd", hostedDomain);
  }

  @Override
  @CircuitBreaker(name = "google", fallbackMethod = "exchangeCodeFallback")
  public TokenResponse exchangeCodeForTokens(String code, String codeVerifier, String redirectUri) {
    log.debug("Exchanging authorization code for tokens with Google");

    FormBody.Builder form = new FormBody.Builder()
        .add("client_id", google.clientId())
        .add("client_secret", google.clientSecret())
        .add("code", code)
        .add("grant_type", "authorization_code")
        .add("redirect_uri", redirectUri);
    if (codeVerifier != null) {
      form.add("code_verifier", codeVerifier);
    }

    return toTokenResponse(postTokenRequest(google.tokenUri(), form.build()), 200);
  }

  public TokenResponse exchangeCodeFallback(String code, String codeVerifier, String redirectUri, Throwable ex) {
    throw translateFallback(Phase.TOKEN_EXCHANGE, ex);
  }

  @Override
  @CircuitBreaker(name = "google", fallbackMethod = "fetchUserFallback")
  public UserPrincipal fetchUserPrincipal(String accessToken) {
    JsonNode profile = getWithBearer(google.userInfoUri(), accessToken, Map.of());

    String id = text(profile, "id");
    if (id == null) {
      throw new UpstreamIdentityException(Phase.PROFILE, 200, UpstreamIdentityException.INVALID_RESPONSE,
                                          profile.toString(),
                                          "Google profile carried no id");
    }
    return new UserPrincipal(id, text(profile, "name"), text(profile, "email"), accessToken);
  }

  public UserPrincipal fetchUserFallback(String accessToken, Throwable ex) {
    throw translateFallback(Phase.PROFILE, ex);
  }
}
