package com.example.mcpauth.config;

import com.example.mcpauth.security.filter.BearerTokenAuthenticationFilter;
import com.example.mcpauth.service.TokenService;
import com.example.mcpauth.web.rest.errors.BearerAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;
import org.springframework.web.servlet.HandlerExceptionResolver;

import java.time.Duration;

/**
 * Stateless security configuration with three filter chains.
 * <p>
 * PUBLIC CHAIN (@Order(1)): OAuth endpoints, discovery documents, health and API docs.
 * PROTECTED CHAIN (@Order(2)): {@code /mcp/**}, authenticated by bearer token.
 * DEFAULT CHAIN (@Order(3)): everything else is denied.
 */
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final TokenService tokenService;
  private final BearerAuthenticationEntryPoint bearerAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/authorize",
                         "/callback",
                         "/token",
                         "/register",
                         "/.well-known/**",
                         "/health",
                         "/health/**",
                         "/actuator/health/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html",
                         "/error")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain protectedEndpointsFilterChain(
      HttpSecurity http,
      @Qualifier("handlerExceptionResolver") HandlerExceptionResolver handlerExceptionResolver) throws Exception {
    http
        .securityMatcher("/mcp/**")
        .addFilterBefore(new BearerTokenAuthenticationFilter(tokenService, handlerExceptionResolver),
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> authorize.anyRequest().authenticated())
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(bearerAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  /**
   * Catches any URL not matched above.
   */
  @Bean
  @Order(3)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll())
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(bearerAuthenticationEntryPoint));
    applyCommonSettings(http);
    return http.build();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        // Bearer tokens and a SameSite consent cookie, no session cookie to protect
        .csrf(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
                               .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                          )
        .headers(headers -> headers
                     .frameOptions(FrameOptionsConfig::deny)
                     .contentTypeOptions(contentType -> {
                     })
                     .referrerPolicy(referrer -> referrer
                                         .policy(ReferrerPolicy.NO_REFERRER)
                                    )
                     .permissionsPolicyHeader(permissions -> permissions
                                                  .policy("camera=(), microphone=(), geolocation=(), payment=()")
                                             )
                     .httpStrictTransportSecurity(hsts -> hsts
                                                      .maxAgeInSeconds(Duration.ofDays(365).toSeconds())
                                                      .includeSubDomains(true)
                                                 )
                     // No form-action: the consent form answers with a redirect to the identity provider
                     .contentSecurityPolicy(csp -> csp
                                                .policyDirectives(
                                                    "default-src 'none'; " +
                                                        "style-src 'unsafe-inline'; " +
                                                        "img-src 'self' data: https:; " +
                                                        "frame-ancestors 'none'; " +
                                                        "base-uri 'none'"
                                                                 )
                                           )
                     .addHeaderWriter((request, response) -> {
                       response.setHeader("Cache-Control", "no-store");
                       response.setHeader("Pragma", "no-cache");
                     })
                );
  }
}
