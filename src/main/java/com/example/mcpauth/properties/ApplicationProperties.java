package com.example.mcpauth.properties;

import com.example.mcpauth.domain.entity.IdpProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Centralized configuration properties for the MCP Auth Gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid ServerProperties server,
    @NotNull @Valid UpstreamProperties upstream,
    @DefaultValue @Valid OAuthProperties oauth,
    @NotNull @Valid ApprovalProperties approval,
    @DefaultValue @Valid AccessProperties access,
    @NotNull @Valid StoreProperties store,
    @DefaultValue @Valid OkHttpProperties http
) {

  /**
   * Public identity of this authorization server
   */
  public record ServerProperties(
      @NotBlank String baseUrl,
      @DefaultValue("MCP Auth Gateway") String name,
      @DefaultValue({"mcp:read", "mcp:write"}) List<String> scopesSupported
  ) {}

  /**
   * Upstream identity provider configuration
   */
  public record UpstreamProperties(
      @DefaultValue("GOOGLE") @NotNull IdpProvider provider,
      @DefaultValue("true") boolean pkceEnabled,
      @DefaultValue @Valid GoogleProperties google,
      @DefaultValue @Valid GitHubProperties github
  ) {
    public record GoogleProperties(
        String clientId,
        String clientSecret,
        @DefaultValue("https://accounts.google.com/o/oauth2/v2/auth") @NotBlank String authorizationUri,
        @DefaultValue("https://oauth2.googleapis.com/token") @NotBlank String tokenUri,
        @DefaultValue("https://www.googleapis.com/oauth2/v2/userinfo") @NotBlank String userInfoUri,
        @DefaultValue("openid email profile") @NotBlank String scope,
        String hostedDomain
    ) {}

    public record GitHubProperties(
        String clientId,
        String clientSecret,
        @DefaultValue("https://github.com/login/oauth/authorize") @NotBlank String authorizationUri,
        @DefaultValue("https://github.com/login/oauth/access_token") @NotBlank String tokenUri,
        @DefaultValue("https://api.github.com/user") @NotBlank String userInfoUri,
        @DefaultValue("https://api.github.com/user/emails") @NotBlank String emailsUri,
        @DefaultValue("read:user user:email") @NotBlank String scope,
        @DefaultValue("mcp-auth-gateway") @NotBlank String userAgent
    ) {}
  }

  /**
   * Downstream authorization server lifetimes and strictness
   */
  public record OAuthProperties(
      @DefaultValue("1h") Duration sessionTtl,
      @DefaultValue("7d") Duration tokenTtl,
      @DefaultValue("30d") Duration clientTtl,
      @DefaultValue("15m") Duration replayGuardTtl,
      @DefaultValue("false") boolean requireRegisteredClient,
      @DefaultValue("false") boolean enforceRedirectUriMatch
  ) {}

  /**
   * Consent cookie signing
   */
  public record ApprovalProperties(
      @NotBlank @Size(min = 32) String signingKey,
      @DefaultValue("mcp-approved-clients") @NotBlank String cookieName,
      @DefaultValue("365d") Duration cookieMaxAge,
      @DefaultValue("true") boolean secureCookie
  ) {}

  /**
   * Principals (user ids or emails) permitted to use restricted tools
   */
  public record AccessProperties(
      @DefaultValue List<String> allowedUsers
  ) {}

  /**
   * Key-value store configuration
   */
  public record StoreProperties(
      @DefaultValue("redis") @Pattern(regexp = "redis|memory") String type,
      @NotBlank String encryptionKey,
      @DefaultValue("100000") @Positive int maxEntries,
      @DefaultValue @Valid RedisProperties redis
  ) {
    public record RedisProperties(
        @DefaultValue("localhost") @NotBlank String host,
        @DefaultValue("6379") @Min(1) @Max(65535) int port,
        String password,
        @DefaultValue("0") @Min(0) int database,
        @DefaultValue("false") boolean ssl,
        @DefaultValue("2s") Duration timeout,
        @DefaultValue @Valid PoolProperties pool
    ) {
      public record PoolProperties(
          @DefaultValue("16") @Positive int maxActive,
          @DefaultValue("8") @Positive int maxIdle,
          @DefaultValue("2") @PositiveOrZero int minIdle,
          @DefaultValue("2s") Duration maxWait
      ) {}
    }
  }

  /**
   * OkHttp client configuration
   */
  public record OkHttpProperties(
      @DefaultValue @Valid ClientProperties client
  ) {
    public record ClientProperties(
        @DefaultValue("20") @Positive int maxIdleConnections,
        @DefaultValue("5") @Positive int keepAliveDurationMinutes,
        @DefaultValue("100") @Positive int maxRequests,
        @DefaultValue("20") @Positive int maxRequestsPerHost,
        @DefaultValue("3s") Duration connectTimeout,
        @DefaultValue("10s") Duration readTimeout
    ) {}
  }
}
