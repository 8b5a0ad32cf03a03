package com.example.mcpauth.adapter.idp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.mcpauth.TestProperties;
import com.example.mcpauth.domain.entity.IdpProvider;
import com.example.mcpauth.domain.entity.UserPrincipal;
import com.example.mcpauth.exception.UpstreamIdentityException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GitHubIdentityClientTest {

  private MockWebServer server;
  private GitHubIdentityClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = new GitHubIdentityClient(
        TestProperties.defaults()
            .provider(IdpProvider.GITHUB)
            .githubEndpoints(server.url("/login/oauth/access_token").toString(), server.url("/user").toString(),
                             server.url("/user/emails").toString())
            .build(),
        new OkHttpClient(),
        new ObjectMapper());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void exchangeRequestsJsonAndParsesToken() throws Exception {
    server.enqueue(json(200, "{\"access_token\":\"gho_abc\",\"scope\":\"read:user,user:email\","
                             + "\"token_type\":\"bearer\"}"));

    IdpClient.TokenResponse tokens = client.exchangeCodeForTokens("gh-code", null, "http://localhost/callback");

    assertThat(tokens.accessToken()).isEqualTo("gho_abc");
    assertThat(tokens.refreshToken()).isNull();
    RecordedRequest request = server.takeRequest();
    assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    assertThat(request.getBody().readUtf8()).contains("client_id=github-client").contains("code=gh-code");
  }

  @Test
  void errorInsideOkResponseIsReported() {
    server.enqueue(json(200, "{\"error\":\"bad_verification_code\","
                             + "\"error_description\":\"The code passed is incorrect or expired.\"}"));

    assertThatThrownBy(() -> client.exchangeCodeForTokens("stale", null, "http://localhost/callback"))
        .isInstanceOfSatisfying(UpstreamIdentityException.class, e -> {
          assertThat(e.getMessage()).isEqualTo("GitHub OAuth error: bad_verification_code");
          assertThat(e.getUpstreamError()).isEqualTo("bad_verification_code");
        });
  }

  @Test
  void profileWithPublicEmailNeedsOneCall() throws Exception {
    server.enqueue(json(200, "{\"id\":583231,\"login\":\"octocat\",\"name\":\"The Octocat\","
                             + "\"email\":\"octocat@github.com\"}"));

    UserPrincipal principal = client.fetchUserPrincipal("gho_abc");

    assertThat(principal).isEqualTo(new UserPrincipal("583231", "The Octocat", "octocat@github.com", "gho_abc"));
    RecordedRequest request = server.takeRequest();
    assertThat(request.getHeader("Accept")).isEqualTo("application/vnd.github+json");
    assertThat(request.getHeader("User-Agent")).isEqualTo("mcp-auth-gateway");
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void privateEmailFallsBackToPrimaryVerifiedAddress() {
    server.enqueue(json(200, "{\"id\":1,\"login\":\"octocat\",\"name\":null,\"email\":null}"));
    server.enqueue(json(200, "[{\"email\":\"old@example.com\",\"primary\":false,\"verified\":true},"
                             + "{\"email\":\"unverified@example.com\",\"primary\":true,\"verified\":false},"
                             + "{\"email\":\"main@example.com\",\"primary\":true,\"verified\":true}]"));

    UserPrincipal principal = client.fetchUserPrincipal("gho_abc");

    assertThat(principal.displayName()).isEqualTo("octocat");
    assertThat(principal.email()).isEqualTo("main@example.com");
  }

  @Test
  void firstVerifiedAddressIsUsedWithoutVerifiedPrimary() {
    server.enqueue(json(200, "{\"id\":1,\"login\":\"octocat\"}"));
    server.enqueue(json(200, "[{\"email\":\"p@example.com\",\"primary\":true,\"verified\":false},"
                             + "{\"email\":\"v@example.com\",\"primary\":false,\"verified\":true}]"));

    assertThat(client.fetchUserPrincipal("gho_abc").email()).isEqualTo("v@example.com");
  }

  @Test
  void noVerifiedAddressLeavesEmailEmpty() {
    server.enqueue(json(200, "{\"id\":1,\"login\":\"octocat\"}"));
    server.enqueue(json(200, "[]"));

    assertThat(client.fetchUserPrincipal("gho_abc").email()).isNull();
  }

  private static MockResponse json(int status, String body) {
    return new MockResponse().setResponseCode(status).setHeader("Content-Type", "application/json").setBody(body);
  }
}
