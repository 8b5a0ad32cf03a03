package com.example.mcpauth.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * RFC 9728 protected resource metadata.
 */
public record ProtectedResourceMetadata(
    @JsonProperty("resource") String resource,
    @JsonProperty("authorization_servers") List<String> authorizationServers,
    @JsonProperty("scopes_supported") List<String> scopesSupported,
    @JsonProperty("bearer_methods_supported") List<String> bearerMethodsSupported,
    @JsonProperty("resource_documentation") String resourceDocumentation,
    @JsonProperty("registration_endpoint") String registrationEndpoint
) {}
