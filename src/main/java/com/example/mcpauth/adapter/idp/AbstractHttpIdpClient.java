package com.example.mcpauth.adapter.idp;

import com.example.mcpauth.exception.UpstreamIdentityException;
import com.example.mcpauth.exception.UpstreamIdentityException.Phase;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.oauth2.sdk.AuthorizationRequest;
import com.nimbusds.oauth2.sdk.ResponseType;
import com.nimbusds.oauth2.sdk.Scope;
import com.nimbusds.oauth2.sdk.id.ClientID;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Shared OkHttp plumbing for providers speaking the plain authorization-code grant.
 */
@Slf4j
abstract class AbstractHttpIdpClient implements IdpClient {

  protected static final String HEADER_AUTHORIZATION = "Authorization";
  protected static final String HEADER_ACCEPT = "Accept";
  protected static final String APPLICATION_JSON = "application/json";

  protected final OkHttpClient httpClient;
  protected final ObjectMapper objectMapper;

  protected AbstractHttpIdpClient(OkHttpClient httpClient, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
  }

  protected abstract String clientId();

  protected abstract String authorizationUri();

  protected abstract String scope();

  /**
   * Extra query parameters for the authorization redirect.
   */
  protected Map<String, String> extraAuthorizationParameters() {
    return Map.of();
  }

  @Override
  public URI buildAuthorizationUri(String redirectUri, String state, String codeVerifier) {
    AuthorizationRequest.Builder builder = new AuthorizationRequest.Builder(
        new ResponseType(ResponseType.Value.CODE), new ClientID(clientId()))
        .endpointURI(URI.create(authorizationUri()))
        .redirectionURI(URI.create(redirectUri))
        .scope(Scope.parse(scope()))
        .state(new State(state));
    if (codeVerifier != null) {
      builder.codeChallenge(new CodeVerifier(codeVerifier), CodeChallengeMethod.S256);
    }
    extraAuthorizationParameters().forEach(builder::customParameter);
    return builder.build().toURI();
  }

  /**
   * POSTs a form to the token endpoint and returns the parsed JSON body of a 2xx answer.
   */
  protected JsonNode postTokenRequest(String tokenUri, FormBody form) {
    Request request = new Request.Builder()
        .url(tokenUri)
        .header(HEADER_ACCEPT, APPLICATION_JSON)
        .post(form)
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      String body = bodyAsString(response);
      if (!response.isSuccessful()) {
        String error = errorCode(body);
        log.error("{} token exchange failed. Status: {}, error: {}, body: {}",
                  provider(), response.code(), error, body);
        throw new UpstreamIdentityException(Phase.TOKEN_EXCHANGE, response.code(), error, body,
                                            provider() + " token exchange failed with status " + response.code());
      }
      return readJson(body, Phase.TOKEN_EXCHANGE, response.code());
    } catch (IOException e) {
      throw new UpstreamIdentityException(Phase.TOKEN_EXCHANGE,
                                          provider() + " token exchange failed due to network error", e);
    }
  }

  /**
   * GETs a JSON document with the upstream access token as bearer credential.
   */
  protected JsonNode getWithBearer(String uri, String accessToken, Map<String, String> headers) {
    Request.Builder builder = new Request.Builder()
        .url(uri)
        .header(HEADER_AUTHORIZATION, "Bearer " + accessToken)
        .header(HEADER_ACCEPT, APPLICATION_JSON)
        .get();
    headers.forEach(builder::header);

    try (Response response = httpClient.newCall(builder.build()).execute()) {
      String body = bodyAsString(response);
      if (!response.isSuccessful()) {
        log.error("{} profile request to {} failed. Status: {}, body: {}", provider(), uri, response.code(), body);
        throw new UpstreamIdentityException(Phase.PROFILE, response.code(), errorCode(body), body,
                                            "Failed to fetch user info from " + provider());
      }
      return readJson(body, Phase.PROFILE, response.code());
    } catch (IOException e) {
      throw new UpstreamIdentityException(Phase.PROFILE,
                                          "Failed to fetch user info from " + provider() + " due to network error", e);
    }
  }

  protected TokenResponse toTokenResponse(JsonNode json, int status) {
    String accessToken = text(json, "access_token");
    if (accessToken == null) {
      throw new UpstreamIdentityException(Phase.TOKEN_EXCHANGE, status, UpstreamIdentityException.INVALID_RESPONSE,
                                          json.toString(),
                                          provider() + " token response carried no access_token");
    }
    return new TokenResponse(accessToken, text(json, "refresh_token"), text(json, "scope"),
                             json.path("expires_in").asLong(0));
  }

  /**
   * Rethrows provider failures unchanged and maps an open circuit to an upstream failure.
   */
  protected UpstreamIdentityException translateFallback(Phase phase, Throwable ex) {
    if (ex instanceof UpstreamIdentityException upstream) {
      return upstream;
    }
    if (ex instanceof CallNotPermittedException) {
      log.error("{} circuit breaker is open during {}", provider(), phase);
      return new UpstreamIdentityException(phase, provider() + " is temporarily unavailable", ex);
    }
    return new UpstreamIdentityException(phase, provider() + " call failed", ex);
  }

  protected static String text(JsonNode json, String field) {
    JsonNode node = json.get(field);
    return node == null || node.isNull() ? null : node.asText();
  }

  private JsonNode readJson(String body, Phase phase, int status) {
    try {
      return objectMapper.readTree(body);
    } catch (IOException e) {
      log.error("{} returned a non-JSON payload during {}: {}", provider(), phase, body);
      throw new UpstreamIdentityException(phase, status, UpstreamIdentityException.INVALID_RESPONSE,
                                          body,
                                          provider() + " returned a malformed response");
    }
  }

  private String errorCode(String body) {
    try {
      JsonNode json = objectMapper.readTree(body);
      return json == null ? null : text(json, "error");
    } catch (IOException e) {
      return null;
    }
  }

  private static String bodyAsString(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }
}
