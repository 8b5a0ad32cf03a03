package com.example.mcpauth.web.rest.controller;

import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.service.ClientRegistrationService;
import com.example.mcpauth.web.rest.ApiConstants.ApiPath;
import com.example.mcpauth.web.rest.dto.AuthorizationServerMetadata;
import com.example.mcpauth.web.rest.dto.ProtectedResourceMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Well-known metadata. All URLs derive from the configured public base URL.
 */
@RestController
@RequiredArgsConstructor
public class DiscoveryController implements DiscoveryAPI {

  private static final String RESOURCE_DOCUMENTATION_PATH = "/swagger-ui.html";

  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<AuthorizationServerMetadata> authorizationServerMetadata() {
    String baseUrl = properties.server().baseUrl();
    return ResponseEntity.ok(new AuthorizationServerMetadata(
        baseUrl,
        baseUrl + ApiPath.AUTHORIZE,
        baseUrl + ApiPath.TOKEN,
        baseUrl + ApiPath.REGISTER,
        List.of(ClientRegistrationService.RESPONSE_TYPE_CODE),
        List.of(ClientRegistrationService.GRANT_TYPE_AUTHORIZATION_CODE),
        List.of("S256"),
        List.of(ClientRegistrationService.AUTH_METHOD_CLIENT_SECRET_POST, "none"),
        properties.server().scopesSupported()));
  }

  @Override
  public ResponseEntity<ProtectedResourceMetadata> protectedResourceMetadata() {
    String baseUrl = properties.server().baseUrl();
    return ResponseEntity.ok(new ProtectedResourceMetadata(
        baseUrl,
        List.of(baseUrl),
        properties.server().scopesSupported(),
        List.of("header"),
        baseUrl + RESOURCE_DOCUMENTATION_PATH,
        baseUrl + ApiPath.REGISTER));
  }
}
