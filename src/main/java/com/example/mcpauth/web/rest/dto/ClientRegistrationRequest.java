package com.example.mcpauth.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * RFC 7591 registration request. Unknown members are ignored.
 */
public record ClientRegistrationRequest(
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("client_name") String clientName,
    @JsonProperty("scope") String scope
) {}
