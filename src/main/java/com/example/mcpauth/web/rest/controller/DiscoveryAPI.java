package com.example.mcpauth.web.rest.controller;

import static com.example.mcpauth.web.rest.ApiConstants.ApiPath.*;

import com.example.mcpauth.web.rest.dto.AuthorizationServerMetadata;
import com.example.mcpauth.web.rest.dto.ProtectedResourceMetadata;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

@Tag(
    name = "Discovery",
    description = "OAuth metadata documents used by MCP clients to find the authorization server"
)
@RequestMapping(produces = MediaType.APPLICATION_JSON_VALUE)
public interface DiscoveryAPI {

  @Operation(summary = "Authorization server metadata (RFC 8414)")
  @GetMapping(value = AUTHORIZATION_SERVER_METADATA)
  ResponseEntity<AuthorizationServerMetadata> authorizationServerMetadata();

  @Operation(summary = "Protected resource metadata (RFC 9728)")
  @GetMapping(value = PROTECTED_RESOURCE_METADATA)
  ResponseEntity<ProtectedResourceMetadata> protectedResourceMetadata();
}
