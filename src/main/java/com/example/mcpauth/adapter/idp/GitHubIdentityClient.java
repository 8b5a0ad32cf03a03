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
 * GitHub OAuth app client.
 *
 * <p>GitHub answers token errors with HTTP 200 and an {@code error} field, and hides private
 * email addresses from {@code /user}; the primary verified address is then read from
 * {@code /user/emails}.
 */
@Slf4j
@Component
public class GitHubIdentityClient extends AbstractHttpIdpClient {

  private static final String GITHUB_JSON = "application/vnd.github+json";
  private static final String HEADER_USER_AGENT = "User-Agent";

  private final ApplicationProperties.UpstreamProperties.GitHubProperties github;

  public GitHubIdentityClient(ApplicationProperties properties, OkHttpClient upstreamOkHttpClient,
                              ObjectMapper objectMapper) {
    super(upstreamOkHttpClient, objectMapper);
    this.github = properties.upstream().github();
  }

  @Override
  public IdpProvider provider() {
    return IdpProvider.GITHUB;
  }

  @Override
  protected String clientId() {
    return github.clientId();
  }

  @Override
  protected String authorizationUri() {
    return github.authorizationUri();
  }

  @Override
  protected String scope() {
    return github.scope();
  }

  @Override
  @CircuitBreaker(name = "github", fallbackMethod = "exchangeCodeFallback")
  public TokenResponse exchangeCodeForTokens(String code, String codeVerifier, String redirectUri) {
    log.debug("Exchanging authorization code for tokens with GitHub");

    FormBody.Builder form = new FormBody.Builder()
        .add("client_id", github.clientId())
        .add("client_secret", github.clientSecret())
        .add("code", code)
        .add("redirect_uri", redirectUri);
    if (codeVerifier != null) {
      form.add("code_verifier", codeVerifier);
    }

    JsonNode json = postTokenRequest(github.tokenUri(), form.build());
    String error = text(json, "error");
    if (error != null) {
      log.error("GitHub token exchange returned error {}: {}", error, text(json, "error_description"));
      throw new UpstreamIdentityException(Phase.TOKEN_EXCHANGE, 200, error, json.toString(),
                                          "GitHub OAuth error: " + error);
    }
    return toTokenResponse(json, 200);
  }

  public TokenResponse exchangeCodeFallback(String code, String codeVerifier, String redirectUri, Throwable ex) {
    throw translateFallback(Phase.TOKEN_EXCHANGE, ex);
  }

  @Override
  @CircuitBreaker(name = "github", fallbackMethod = "fetchUserFallback")
  public UserPrincipal fetchUserPrincipal(String accessToken) {
    Map<String, String> headers = Map.of(HEADER_ACCEPT, GITHUB_JSON, HEADER_USER_AGENT, github.userAgent());
    JsonNode user = getWithBearer(github.userInfoUri(), accessToken, headers);

    JsonNode idNode = user.get("id");
    if (idNode == null || idNode.isNull()) {
      throw new UpstreamIdentityException(Phase.PROFILE, 200, UpstreamIdentityException.INVALID_RESPONSE,
                                          user.toString(),
                                          "GitHub profile carried no id");
    }
    String login = text(user, "login");
    String name = text(user, "name");
    String email = text(user, "email");
    if (email == null) {
      email = primaryVerifiedEmail(accessToken, headers);
    }
    return new UserPrincipal(idNode.asText(), name != null ? name : login, email, accessToken);
  }

  public UserPrincipal fetchUserFallback(String accessToken, Throwable ex) {
    throw translateFallback(Phase.PROFILE, ex);
  }

  private String primaryVerifiedEmail(String accessToken, Map<String, String> headers) {
    JsonNode emails = getWithBearer(github.emailsUri(), accessToken, headers);
    String firstVerified = null;
    for (JsonNode entry : emails) {
      if (!entry.path("verified").asBoolean(false)) {
        continue;
      }
      if (entry.path("primary").asBoolean(false)) {
        return text(entry, "email");
      }
      if (firstVerified == null) {
        firstVerified = text(entry, "email");
      }
    }
    return firstVerified;
  }
}
