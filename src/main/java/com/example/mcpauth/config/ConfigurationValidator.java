package com.example.mcpauth.config;

import com.example.mcpauth.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Configuration validator that enforces rules beyond basic JSR-303 validation.
 * Fails fast with every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS in non-local environments: %s";
  private static final String ERROR_MISSING_CREDENTIAL = "%s must be set when the upstream provider is %s";
  private static final String SCHEME_HTTP = "http";
  private static final String SCHEME_HTTPS = "https";
  private static final List<String> LOCAL_HOSTS = List.of("localhost", "127.0.0.1");
  private static final int AES_256_KEY_BYTES = 32;
  private static final int MIN_SIGNING_KEY_LENGTH = 32;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully (upstream provider: {}, store: {})",
             properties.upstream().provider(), properties.store().type());
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateServerConfig(errors);
    validateUpstreamConfig(errors);
    validateOAuthConfig(errors);
    validateApprovalConfig(errors);
    validateStoreConfig(errors);
    validateHttpConfig(errors);
    return errors;
  }

  private void validateServerConfig(List<String> errors) {
    String baseUrl = properties.server().baseUrl();
    URI uri = parseAbsolute(baseUrl);
    if (uri == null || !(SCHEME_HTTP.equals(uri.getScheme()) || SCHEME_HTTPS.equals(uri.getScheme()))) {
      errors.add(ERROR_INVALID_URL.formatted("Server base URL", baseUrl));
      return;
    }
    if (baseUrl.endsWith("/")) {
      errors.add("Server base URL must not end with '/': " + baseUrl);
    }
    if (SCHEME_HTTP.equals(uri.getScheme()) && !LOCAL_HOSTS.contains(uri.getHost())) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted("Server base URL", baseUrl));
    }
  }

  private void validateUpstreamConfig(List<String> errors) {
    ApplicationProperties.UpstreamProperties upstream = properties.upstream();
    switch (upstream.provider()) {
      case GOOGLE -> {
        ApplicationProperties.UpstreamProperties.GoogleProperties google = upstream.google();
        requireCredential(google.clientId(), "app.upstream.google.client-id", errors);
        requireCredential(google.clientSecret(), "app.upstream.google.client-secret", errors);
        validateUri(google.authorizationUri(), "Google authorization URI", errors);
        validateUri(google.tokenUri(), "Google token URI", errors);
        validateUri(google.userInfoUri(), "Google userinfo URI", errors);
      }
      case GITHUB -> {
        ApplicationProperties.UpstreamProperties.GitHubProperties github = upstream.github();
        requireCredential(github.clientId(), "app.upstream.github.client-id", errors);
        requireCredential(github.clientSecret(), "app.upstream.github.client-secret", errors);
        validateUri(github.authorizationUri(), "GitHub authorization URI", errors);
        validateUri(github.tokenUri(), "GitHub token URI", errors);
        validateUri(github.userInfoUri(), "GitHub user URI", errors);
        validateUri(github.emailsUri(), "GitHub emails URI", errors);
      }
    }
  }

  private void validateOAuthConfig(List<String> errors) {
    ApplicationProperties.OAuthProperties oauth = properties.oauth();
    requirePositive(oauth.sessionTtl(), "Session TTL", errors);
    requirePositive(oauth.tokenTtl(), "Token TTL", errors);
    requirePositive(oauth.clientTtl(), "Client registration TTL", errors);
    requirePositive(oauth.replayGuardTtl(), "Replay guard TTL", errors);
    if (oauth.sessionTtl().compareTo(oauth.tokenTtl()) >= 0) {
      errors.add("Session TTL (%s) must be shorter than token TTL (%s)".formatted(oauth.sessionTtl(), oauth.tokenTtl()));
    }
    if (oauth.enforceRedirectUriMatch() && !oauth.requireRegisteredClient()) {
      errors.add("app.oauth.enforce-redirect-uri-match requires app.oauth.require-registered-client");
    }
  }

  private void validateApprovalConfig(List<String> errors) {
    String signingKey = properties.approval().signingKey();
    if (signingKey == null || signingKey.length() < MIN_SIGNING_KEY_LENGTH) {
      errors.add("app.approval.signing-key must be at least " + MIN_SIGNING_KEY_LENGTH + " characters");
    }
  }

  private void validateStoreConfig(List<String> errors) {
    try {
      byte[] key = Base64.getDecoder().decode(properties.store().encryptionKey());
      if (key.length != AES_256_KEY_BYTES) {
        errors.add("app.store.encryption-key must decode to 32 bytes, but was " + key.length);
      }
    } catch (IllegalArgumentException e) {
      errors.add("app.store.encryption-key must be Base64 encoded");
    }
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties.ClientProperties client = properties.http().client();
    if (client.maxRequests() < client.maxRequestsPerHost()) {
      errors.add("Total max requests must be greater than or equal to max requests per host.");
    }
  }

  private void requireCredential(String value, String name, List<String> errors) {
    if (value == null || value.isBlank()) {
      errors.add(ERROR_MISSING_CREDENTIAL.formatted(name, properties.upstream().provider()));
    }
  }

  private void requirePositive(Duration duration, String name, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add(name + " must be positive.");
    }
  }

  private void validateUri(String uri, String fieldName, List<String> errors) {
    if (parseAbsolute(uri) == null) {
      errors.add(ERROR_INVALID_URL.formatted(fieldName, uri));
    }
  }

  private static URI parseAbsolute(String value) {
    if (value == null) {
      return null;
    }
    try {
      URI uri = new URI(value);
      return uri.isAbsolute() && uri.getHost() != null ? uri : null;
    } catch (URISyntaxException e) {
      return null;
    }
  }
}
