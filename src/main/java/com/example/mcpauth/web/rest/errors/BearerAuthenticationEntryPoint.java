package com.example.mcpauth.web.rest.errors;

import com.example.mcpauth.properties.ApplicationProperties;
import com.example.mcpauth.web.rest.ApiConstants.ApiPath;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Answers unauthenticated calls to protected resources with a JSON 401 and a
 * {@code WWW-Authenticate} challenge pointing at the protected-resource metadata, so MCP
 * clients can discover where to authorize.
 */
@Component
@RequiredArgsConstructor
public class BearerAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ApplicationProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    String resourceMetadata = properties.server().baseUrl() + ApiPath.PROTECTED_RESOURCE_METADATA;
    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer resource_metadata=\"" + resourceMetadata + "\"");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(),
                            ErrorResponse.of(HttpStatus.UNAUTHORIZED, ErrorResponse.UNAUTHORIZED,
                                             "Missing or invalid bearer token", request.getRequestURI()));
  }
}
